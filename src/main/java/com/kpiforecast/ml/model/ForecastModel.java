package com.kpiforecast.ml.model;

import com.kpiforecast.ml.DailySeries;

/**
 * A forecasting algorithm that can be trained on a prepared daily series. Implementations are
 * stateless; all fitted state lives in the returned {@link FittedModel}.
 */
public interface ForecastModel {

    ModelType type();

    FittedModel fit(DailySeries series);
}
