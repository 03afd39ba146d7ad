package com.kpiforecast.ml.model;

/**
 * Point forecast with its interval, one entry per future day.
 */
public record ForecastBand(double[] predicted, double[] lower, double[] upper) {

    public ForecastBand {
        if (predicted.length != lower.length || predicted.length != upper.length) {
            throw new IllegalArgumentException("predicted, lower and upper must have equal length");
        }
    }

    public int size() {
        return predicted.length;
    }

    public ForecastBand clippedAtZero() {
        return new ForecastBand(clip(predicted), clip(lower), clip(upper));
    }

    private static double[] clip(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = Math.max(0.0, values[i]);
        }
        return out;
    }
}
