package com.kpiforecast.ml;

import com.kpiforecast.exception.InsufficientDataException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SeriesPreparerTest {

    private static final LocalDate D = LocalDate.of(2024, 3, 1);

    @Test
    void fillsMissingDaysWithZero() {
        DailySeries series = SeriesPreparer.prepare(List.of(
            new MetricObservation(D.plusDays(3), "total_orders", 7.0),
            new MetricObservation(D, "total_orders", 5.0)));

        assertThat(series.startDate()).isEqualTo(D);
        assertThat(series.endDate()).isEqualTo(D.plusDays(3));
        assertThat(series.values()).containsExactly(5.0, 0.0, 0.0, 7.0);
    }

    @Test
    void laterDuplicateWins() {
        DailySeries series = SeriesPreparer.prepare(List.of(
            new MetricObservation(D, "total_orders", 5.0),
            new MetricObservation(D, "total_orders", 9.0)));
        assertThat(series.values()).containsExactly(9.0);
    }

    @Test
    void emptyInput_isInsufficient() {
        assertThatThrownBy(() -> SeriesPreparer.prepare(List.of()))
            .isInstanceOf(InsufficientDataException.class)
            .satisfies(ex -> assertThat(((InsufficientDataException) ex).getRequired()).isEqualTo(1));
    }

    @Test
    void seriesIsDefensivelyCopied() {
        double[] values = {1, 2, 3};
        DailySeries series = new DailySeries(D, values);
        values[0] = 99;
        series.values()[1] = 99;
        assertThat(series.values()).containsExactly(1, 2, 3);
        assertThat(series.tail(2).startDate()).isEqualTo(D.plusDays(1));
    }
}
