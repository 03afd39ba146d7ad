package com.kpiforecast.ml;

import com.kpiforecast.ml.model.ModelType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class BacktestResult {
    ModelType modelType;
    Map<String, Object> params;
    double mape;
    double smape;
    double rmse;
    double mae;
    double baselineMape;
    double baselineRmse;
    /** Null when the baseline MAPE is 0. */
    Double improvementPct;
    LocalDate trainStart;
    LocalDate trainEnd;
    int trainSamples;
    int testSamples;
    List<HoldoutPoint> holdout;
}
