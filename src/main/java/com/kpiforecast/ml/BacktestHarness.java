package com.kpiforecast.ml;

import com.kpiforecast.exception.InsufficientDataException;
import com.kpiforecast.ml.model.FittedModel;
import com.kpiforecast.ml.model.ForecastBand;
import com.kpiforecast.ml.model.ForecastModel;

import java.util.ArrayList;
import java.util.List;

/**
 * Holdout evaluation: the most recent {@code holdoutDays} are withheld, the model is fitted on the
 * rest, and its forecast is scored against both the withheld actuals and the naive baseline.
 * Order is never shuffled.
 */
public final class BacktestHarness {

    public static final int MIN_TRAIN_DAYS = 30;

    private BacktestHarness() {
    }

    public static int requiredDays(int holdoutDays) {
        return holdoutDays + MIN_TRAIN_DAYS;
    }

    public static BacktestResult run(DailySeries series, ForecastModel model, int holdoutDays) {
        if (holdoutDays < 1) {
            throw new IllegalArgumentException("holdoutDays must be >= 1");
        }
        int required = requiredDays(holdoutDays);
        if (series.size() < required) {
            throw new InsufficientDataException("backtesting", required, series.size());
        }

        DailySeries train = series.head(series.size() - holdoutDays);
        DailySeries test = series.tail(holdoutDays);

        FittedModel fitted = model.fit(train);
        ForecastBand band = fitted.predict(holdoutDays).clippedAtZero();
        double[] actuals = test.values();
        double[] predictions = band.predicted();
        double[] baseline = EvaluationMetrics.naiveBaseline(train.values(), holdoutDays);

        double mape = EvaluationMetrics.mape(actuals, predictions);
        double baselineMape = EvaluationMetrics.mape(actuals, baseline);

        List<HoldoutPoint> holdout = new ArrayList<>(holdoutDays);
        for (int i = 0; i < holdoutDays; i++) {
            holdout.add(new HoldoutPoint(test.dateAt(i), actuals[i], predictions[i],
                band.lower()[i], band.upper()[i]));
        }

        return BacktestResult.builder()
            .modelType(model.type())
            .params(fitted.paramsUsed())
            .mape(mape)
            .smape(EvaluationMetrics.smape(actuals, predictions))
            .rmse(EvaluationMetrics.rmse(actuals, predictions))
            .mae(EvaluationMetrics.mae(actuals, predictions))
            .baselineMape(baselineMape)
            .baselineRmse(EvaluationMetrics.rmse(actuals, baseline))
            .improvementPct(EvaluationMetrics.improvementPct(baselineMape, mape))
            .trainStart(train.startDate())
            .trainEnd(train.endDate())
            .trainSamples(train.size())
            .testSamples(holdoutDays)
            .holdout(List.copyOf(holdout))
            .build();
    }
}
