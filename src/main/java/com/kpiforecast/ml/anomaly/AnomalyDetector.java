package com.kpiforecast.ml.anomaly;

import com.kpiforecast.ml.MetricObservation;
import com.kpiforecast.ml.Precision;
import lombok.extern.slf4j.Slf4j;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Weekday/weekend aware anomaly detection. Each day is compared to a trailing baseline built only
 * from days of the same type, then flagged when either the outlier scorer marks its residual or
 * its z-score leaves the 2.5 band.
 */
@Slf4j
public class AnomalyDetector {

    public static final int MIN_OBSERVATIONS = 14;
    public static final double DEFAULT_CONTAMINATION = 0.1;

    public static final int ROLLING_WINDOW = 4;
    public static final int ROLLING_MIN_PERIODS = 2;
    public static final double Z_THRESHOLD = 2.5;

    private final OutlierScorer scorer;

    public AnomalyDetector(OutlierScorer scorer) {
        this.scorer = scorer;
    }

    /**
     * @param observations one metric's observations; gaps are allowed and order is not required
     * @return flagged days in date order; empty when fewer than 14 observations are given
     */
    public List<AnomalyFinding> detect(List<MetricObservation> observations, String metric, double contamination) {
        if (observations.size() < MIN_OBSERVATIONS) {
            log.debug("Anomaly detection skipped | metric={} | observations={}", metric, observations.size());
            return List.of();
        }
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got " + contamination);
        }

        List<MetricObservation> rows = new ArrayList<>(observations);
        rows.sort(Comparator.comparing(MetricObservation::date));
        int n = rows.size();

        double[] actual = new double[n];
        boolean[] weekend = new boolean[n];
        for (int i = 0; i < n; i++) {
            actual[i] = rows.get(i).value();
            weekend[i] = isWeekend(rows.get(i).date().getDayOfWeek());
        }

        double weekendMean = dayTypeMean(actual, weekend, true);
        double weekdayMean = dayTypeMean(actual, weekend, false);
        double seriesStd = sampleStd(actual, 0, n);

        double[] expected = new double[n];
        double[] std = new double[n];
        double[] residual = new double[n];
        fillRollingBaseline(actual, weekend, true, weekendMean, seriesStd, expected, std);
        fillRollingBaseline(actual, weekend, false, weekdayMean, seriesStd, expected, std);
        for (int i = 0; i < n; i++) {
            residual[i] = actual[i] - expected[i];
        }

        boolean[] scorerFlags = scorer.flagOutliers(residual, contamination);

        List<AnomalyFinding> findings = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double divisor = std[i] == 0.0 ? 1.0 : std[i];
            double z = residual[i] / divisor;
            double base = expected[i] == 0.0 ? 1.0 : expected[i];
            double deviation = Precision.round2(residual[i] / base * 100.0);

            if (!(scorerFlags[i] || Math.abs(z) > Z_THRESHOLD)) {
                continue;
            }
            AnomalyType type;
            if (actual[i] > expected[i]) {
                type = AnomalyType.SPIKE;
            } else if (actual[i] < expected[i]) {
                type = AnomalyType.DROP;
            } else {
                continue;
            }

            LocalDate date = rows.get(i).date();
            DayOfWeek day = date.getDayOfWeek();
            Severity severity = Severity.classify(z, deviation);
            findings.add(new AnomalyFinding(
                date, metric, actual[i], expected[i], deviation, z, type, severity, weekend[i],
                day.getValue() - 1,
                AnomalyRules.interpretation(type, weekend[i], day, metric),
                AnomalyRules.recommendedAction(type, severity)));
        }
        log.info("Anomaly scan finished | metric={} | checked={} | flagged={}", metric, n, findings.size());
        return findings;
    }

    static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    private static void fillRollingBaseline(double[] actual, boolean[] weekend, boolean dayType,
                                            double dayTypeMean, double seriesStd,
                                            double[] expected, double[] std) {
        double[] window = new double[ROLLING_WINDOW];
        int seen = 0;
        for (int i = 0; i < actual.length; i++) {
            if (weekend[i] != dayType) {
                continue;
            }
            window[seen % ROLLING_WINDOW] = actual[i];
            seen++;
            int filled = Math.min(seen, ROLLING_WINDOW);
            if (filled >= ROLLING_MIN_PERIODS) {
                expected[i] = mean(window, filled);
                std[i] = sampleStd(window, 0, filled);
            } else {
                expected[i] = dayTypeMean;
                std[i] = seriesStd;
            }
        }
    }

    private static double dayTypeMean(double[] values, boolean[] weekend, boolean dayType) {
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < values.length; i++) {
            if (weekend[i] == dayType) {
                sum += values[i];
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    private static double mean(double[] values, int count) {
        double sum = 0.0;
        for (int i = 0; i < count; i++) {
            sum += values[i];
        }
        return sum / count;
    }

    private static double sampleStd(double[] values, int from, int to) {
        int count = to - from;
        if (count < 2) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        double mean = sum / count;
        double squares = 0.0;
        for (int i = from; i < to; i++) {
            squares += (values[i] - mean) * (values[i] - mean);
        }
        return Math.sqrt(squares / (count - 1));
    }
}
