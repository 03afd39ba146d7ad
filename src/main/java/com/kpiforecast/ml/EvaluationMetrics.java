package com.kpiforecast.ml;

import java.util.Arrays;

/**
 * Forecast accuracy metrics over equal-length actual/predicted arrays, plus the naive weekly
 * baseline every trained model is compared against.
 */
public final class EvaluationMetrics {

    private static final int SEASON = 7;

    private EvaluationMetrics() {
    }

    /** Mean absolute percentage error over positions where actual != 0; 0 when none remain. */
    public static double mape(double[] actual, double[] predicted) {
        requireSameLength(actual, predicted);
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < actual.length; i++) {
            if (actual[i] != 0.0d) {
                sum += Math.abs((actual[i] - predicted[i]) / actual[i]);
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count * 100.0;
    }

    /** Symmetric MAPE; positions whose mean magnitude is 0 are masked out. */
    public static double smape(double[] actual, double[] predicted) {
        requireSameLength(actual, predicted);
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < actual.length; i++) {
            double denominator = (Math.abs(actual[i]) + Math.abs(predicted[i])) / 2.0;
            if (denominator != 0.0d) {
                sum += Math.abs(actual[i] - predicted[i]) / denominator;
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count * 100.0;
    }

    public static double rmse(double[] actual, double[] predicted) {
        requireSameLength(actual, predicted);
        if (actual.length == 0) {
            return 0.0;
        }
        double squared = 0.0;
        for (int i = 0; i < actual.length; i++) {
            double err = actual[i] - predicted[i];
            squared += err * err;
        }
        return Math.sqrt(squared / actual.length);
    }

    public static double mae(double[] actual, double[] predicted) {
        requireSameLength(actual, predicted);
        if (actual.length == 0) {
            return 0.0;
        }
        double abs = 0.0;
        for (int i = 0; i < actual.length; i++) {
            abs += Math.abs(actual[i] - predicted[i]);
        }
        return abs / actual.length;
    }

    /**
     * "Last week repeats this week". With fewer than seven training points the training mean is
     * repeated instead.
     */
    public static double[] naiveBaseline(double[] train, int horizon) {
        double[] forecast = new double[horizon];
        int n = train.length;
        if (n < SEASON) {
            double mean = Arrays.stream(train).average().orElse(0.0);
            Arrays.fill(forecast, mean);
            return forecast;
        }
        for (int i = 0; i < horizon; i++) {
            forecast[i] = train[n - SEASON + (i % SEASON)];
        }
        return forecast;
    }

    /** Relative gain over the baseline in percent; null when the baseline MAPE is not positive. */
    public static Double improvementPct(Double baselineMape, Double mape) {
        if (baselineMape == null || mape == null || baselineMape <= 0.0) {
            return null;
        }
        return (baselineMape - mape) / baselineMape * 100.0;
    }

    private static void requireSameLength(double[] actual, double[] predicted) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException(
                "actual and predicted must have equal length: " + actual.length + " vs " + predicted.length);
        }
    }
}
