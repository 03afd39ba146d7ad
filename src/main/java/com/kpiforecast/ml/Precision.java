package com.kpiforecast.ml;

/** Half-up decimal rounding applied where values leave the computation. */
public final class Precision {

    private Precision() {
    }

    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }

    public static double round2(double value) {
        return round(value, 2);
    }

    public static Double round(Double value, int decimals) {
        return value == null ? null : round(value.doubleValue(), decimals);
    }
}
