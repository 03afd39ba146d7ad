package com.kpiforecast.ml.model;

import java.util.Map;

public interface FittedModel {

    /**
     * Forecasts the {@code horizon} days following the training series. Values are clipped at 0
     * and left unrounded.
     */
    ForecastBand predict(int horizon);

    /** Hyperparameters and fitted constants, flat, for the run ledger. */
    Map<String, Object> paramsUsed();

    /** Nominal coverage of the interval returned by {@link #predict(int)}. */
    double confidenceLevel();
}
