package com.kpiforecast.ml;

import com.kpiforecast.exception.NoUsableModelException;
import com.kpiforecast.ml.model.ForecastModel;
import com.kpiforecast.ml.model.ModelType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backtests every candidate on the same series and holdout and keeps the lowest MAPE. A candidate
 * that throws is excluded; ties go to the earlier candidate.
 */
@Slf4j
public final class ModelSelector {

    private ModelSelector() {
    }

    public static SelectionResult select(DailySeries series, List<? extends ForecastModel> candidates,
                                         int holdoutDays) {
        List<BacktestResult> results = new ArrayList<>();
        Map<ModelType, String> failures = new LinkedHashMap<>();
        BacktestResult best = null;

        for (ForecastModel candidate : candidates) {
            try {
                BacktestResult result = BacktestHarness.run(series, candidate, holdoutDays);
                results.add(result);
                log.info("Candidate evaluated | model={} | mape={} | baselineMape={}",
                         candidate.type().id(), result.getMape(), result.getBaselineMape());
                if (best == null || result.getMape() < best.getMape()) {
                    best = result;
                }
            } catch (RuntimeException ex) {
                String reason = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
                failures.put(candidate.type(), reason);
                log.warn("Candidate excluded | model={} | reason={}", candidate.type().id(), reason);
            }
        }

        if (best == null) {
            Map<String, String> reasons = new LinkedHashMap<>();
            failures.forEach((type, reason) -> reasons.put(type.id(), reason));
            throw new NoUsableModelException(reasons);
        }
        return new SelectionResult(best.getModelType(), List.copyOf(results), Collections.unmodifiableMap(failures));
    }
}
