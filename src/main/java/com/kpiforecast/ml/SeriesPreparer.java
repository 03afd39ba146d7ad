package com.kpiforecast.ml;

import com.kpiforecast.exception.InsufficientDataException;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;

/**
 * Turns sparse observations into a daily series spanning min..max date. Missing days become 0;
 * when a date repeats, the later observation wins.
 */
public final class SeriesPreparer {

    private SeriesPreparer() {
    }

    public static DailySeries prepare(List<MetricObservation> observations) {
        if (observations == null || observations.isEmpty()) {
            throw new InsufficientDataException("series preparation", 1, 0);
        }
        LocalDate start = observations.stream().map(MetricObservation::date)
            .min(Comparator.naturalOrder()).orElseThrow();
        LocalDate end = observations.stream().map(MetricObservation::date)
            .max(Comparator.naturalOrder()).orElseThrow();

        double[] values = new double[(int) ChronoUnit.DAYS.between(start, end) + 1];
        for (MetricObservation o : observations) {
            values[(int) ChronoUnit.DAYS.between(start, o.date())] = o.value();
        }
        return new DailySeries(start, values);
    }
}
