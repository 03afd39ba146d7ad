package com.kpiforecast.ml;

import com.kpiforecast.ml.model.ModelType;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a model selection: the winner, every successful backtest in registration order,
 * and the failure message of each excluded candidate.
 */
public record SelectionResult(ModelType winner, List<BacktestResult> results, Map<ModelType, String> failures) {

    public BacktestResult winningResult() {
        return results.stream()
            .filter(r -> r.getModelType() == winner)
            .findFirst()
            .orElseThrow();
    }
}
