package com.kpiforecast.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kpiforecast.dto.BacktestResponse;
import com.kpiforecast.dto.ForecastPointResponse;
import com.kpiforecast.dto.ForecastResponse;
import com.kpiforecast.entity.BacktestPoint;
import com.kpiforecast.entity.ForecastRecord;
import com.kpiforecast.entity.KpiMetric;
import com.kpiforecast.entity.ModelRun;
import com.kpiforecast.exception.InsufficientDataException;
import com.kpiforecast.ml.BacktestHarness;
import com.kpiforecast.ml.BacktestResult;
import com.kpiforecast.ml.DailySeries;
import com.kpiforecast.ml.HoldoutPoint;
import com.kpiforecast.ml.ModelSelector;
import com.kpiforecast.ml.Precision;
import com.kpiforecast.ml.SelectionResult;
import com.kpiforecast.ml.SeriesPreparer;
import com.kpiforecast.ml.model.FittedModel;
import com.kpiforecast.ml.model.ForecastBand;
import com.kpiforecast.ml.model.ForecastModel;
import com.kpiforecast.ml.model.ModelType;
import com.kpiforecast.repository.ResultLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastingService {

    static final String CREATED_BY = "kpi-forecasting";
    static final String STATUS_COMPLETED = "completed";

    private final MetricHistoryService history;
    private final ModelRegistryService registry;
    private final ResultLedger ledger;
    private final ObjectMapper mapper = new ObjectMapper();

    @Value("${forecasting.model-version:2.0.0}")
    private String modelVersion;

    @Value("${forecasting.code-version:2024.01.1}")
    private String codeVersion;

    @Value("${forecasting.default-holdout-days:14}")
    private int holdoutDays;

    /**
     * Forecasts {@code horizonDays} days past the last observed day and persists them. With
     * {@code auto} every registered model is backtested first and the lowest-MAPE one is used.
     */
    public ForecastResponse forecast(String metric, int horizonDays, String modelChoice) {
        KpiMetric kpi = history.resolveMetric(metric);
        if (horizonDays < 1) {
            throw new IllegalArgumentException("horizonDays must be >= 1");
        }
        ForecastModel explicit = registry.isAuto(modelChoice) ? null : registry.resolve(modelChoice);

        DailySeries series = SeriesPreparer.prepare(
            MetricHistoryService.observations(history.readAll("forecasting"), kpi));
        return runForecast(kpi, series, horizonDays, explicit);
    }

    /**
     * Backtests one model, or every registered model when {@code auto}, on the most recent
     * {@code holdoutDays}. Nothing is persisted.
     */
    public BacktestResponse backtest(String metric, String modelChoice, int holdoutDays) {
        KpiMetric kpi = history.resolveMetric(metric);
        if (holdoutDays < 1) {
            throw new IllegalArgumentException("holdoutDays must be >= 1");
        }
        ForecastModel explicit = registry.isAuto(modelChoice) ? null : registry.resolve(modelChoice);

        DailySeries series = SeriesPreparer.prepare(
            MetricHistoryService.observations(history.readAll("backtesting"), kpi));

        if (explicit != null) {
            BacktestResult result = BacktestHarness.run(series, explicit, holdoutDays);
            log.info("Backtest finished | metric={} | model={} | mape={}",
                     kpi.columnName(), explicit.type().id(), result.getMape());
            return toBacktestResponse(kpi, result, null);
        }
        SelectionResult selection = select(series, holdoutDays, "backtesting");
        return toBacktestResponse(kpi, selection.winningResult(), selection);
    }

    /**
     * Fits on {@code series} (selecting a model first when {@code explicit} is null), records the
     * run and upserts the forecast.
     */
    public ForecastResponse runForecast(KpiMetric kpi, DailySeries series, int horizonDays, ForecastModel explicit) {
        ForecastModel model;
        FittedModel fitted;
        long runId;
        if (explicit == null) {
            SelectionResult selection = select(series, holdoutDays, "automatic model selection");
            BacktestResult best = selection.winningResult();
            model = registry.resolve(selection.winner());
            runId = ledger.recordRun(evaluatedRun(kpi, best, selection));
            ledger.recordBacktestPoints(runId, toBacktestPoints(runId, best.getHoldout()));
            fitted = model.fit(series);
        } else {
            model = explicit;
            fitted = model.fit(series);
            runId = ledger.recordRun(unevaluatedRun(kpi, model.type(), series, fitted));
        }
        ForecastBand band = fitted.predict(horizonDays).clippedAtZero();

        List<ForecastRecord> records = toRecords(kpi, series.endDate(), band, fitted, model.type(), runId);
        int written = ledger.upsertForecasts(records);
        log.info("Forecast saved | metric={} | model={} | horizon={} | rows={} | runId={}",
                 kpi.columnName(), model.type().id(), horizonDays, written, runId);

        return ForecastResponse.builder()
            .metric(kpi.columnName())
            .modelName(model.type().displayName())
            .modelVersion(modelVersion)
            .runId(runId)
            .horizonDays(horizonDays)
            .forecasts(records.stream().map(ForecastingService::toPointResponse).toList())
            .createdAt(Instant.now())
            .build();
    }

    private SelectionResult select(DailySeries series, int holdout, String operation) {
        int required = BacktestHarness.requiredDays(holdout);
        if (series.size() < required) {
            throw new InsufficientDataException(operation, required, series.size());
        }
        SelectionResult selection = ModelSelector.select(series, registry.candidates(), holdout);
        log.info("Model selected | winner={} | candidates={} | excluded={}",
                 selection.winner().id(), selection.results().size(), selection.failures().keySet());
        return selection;
    }

    private List<ForecastRecord> toRecords(KpiMetric kpi, LocalDate lastDate, ForecastBand band,
                                           FittedModel fitted, ModelType type, long runId) {
        List<ForecastRecord> records = new ArrayList<>(band.size());
        for (int i = 0; i < band.size(); i++) {
            records.add(ForecastRecord.builder()
                .forecastDate(lastDate.plusDays(i + 1L))
                .metricName(kpi.columnName())
                .predictedValue(Precision.round2(band.predicted()[i]))
                .lowerBound(Precision.round2(band.lower()[i]))
                .upperBound(Precision.round2(band.upper()[i]))
                .confidenceLevel(Precision.round2(fitted.confidenceLevel()))
                .modelRunId(runId)
                .modelName(type.displayName())
                .modelVersion(modelVersion)
                .build());
        }
        return records;
    }

    private ModelRun evaluatedRun(KpiMetric kpi, BacktestResult best, SelectionResult selection) {
        Map<String, Object> params = new LinkedHashMap<>(best.getParams());
        params.put("holdout_days", best.getTestSamples());
        return ModelRun.builder()
            .modelType(best.getModelType().ledgerType())
            .targetMetric(kpi.columnName())
            .trainStartDate(best.getTrainStart())
            .trainEndDate(best.getTrainEnd())
            .trainSamples(best.getTrainSamples())
            .parameters(toJson(params))
            .mape(Precision.round(best.getMape(), 4))
            .smape(Precision.round(best.getSmape(), 4))
            .rmse(Precision.round(best.getRmse(), 4))
            .mae(Precision.round(best.getMae(), 4))
            .baselineMape(Precision.round(best.getBaselineMape(), 4))
            .baselineRmse(Precision.round(best.getBaselineRmse(), 4))
            .improvementPct(Precision.round(best.getImprovementPct(), 4))
            .modelVersion(modelVersion)
            .codeVersion(codeVersion)
            .status(STATUS_COMPLETED)
            .createdBy(CREATED_BY)
            .notes(selectionNotes(selection))
            .build();
    }

    private ModelRun unevaluatedRun(KpiMetric kpi, ModelType type, DailySeries series, FittedModel fitted) {
        return ModelRun.builder()
            .modelType(type.ledgerType())
            .targetMetric(kpi.columnName())
            .trainStartDate(series.startDate())
            .trainEndDate(series.endDate())
            .trainSamples(series.size())
            .parameters(toJson(fitted.paramsUsed()))
            .modelVersion(modelVersion)
            .codeVersion(codeVersion)
            .status(STATUS_COMPLETED)
            .createdBy(CREATED_BY)
            .notes("Explicit model choice, no holdout evaluation")
            .build();
    }

    private static String selectionNotes(SelectionResult selection) {
        StringBuilder notes = new StringBuilder("Selected from:");
        for (BacktestResult r : selection.results()) {
            notes.append(' ').append(r.getModelType().id())
                 .append(" mape=").append(Precision.round(r.getMape(), 4)).append(';');
        }
        selection.failures().forEach((type, reason) ->
            notes.append(' ').append(type.id()).append(" excluded (").append(reason).append(");"));
        return notes.toString();
    }

    static List<BacktestPoint> toBacktestPoints(long runId, List<HoldoutPoint> holdout) {
        return holdout.stream()
            .map(p -> BacktestPoint.builder()
                .runId(runId)
                .predictionDate(p.date())
                .actualValue(Precision.round2(p.actual()))
                .predictedValue(Precision.round2(p.predicted()))
                .lowerBound(Precision.round2(p.lower()))
                .upperBound(Precision.round2(p.upper()))
                .absoluteError(Precision.round2(Math.abs(p.actual() - p.predicted())))
                .percentageError(p.actual() == 0.0d ? null
                    : Precision.round(Math.abs(p.actual() - p.predicted()) / Math.abs(p.actual()) * 100.0, 4))
                .withinInterval(p.withinInterval())
                .build())
            .toList();
    }

    private BacktestResponse toBacktestResponse(KpiMetric kpi, BacktestResult result, SelectionResult selection) {
        BacktestResponse.BacktestResponseBuilder builder = BacktestResponse.builder()
            .metric(kpi.columnName())
            .model(result.getModelType().id())
            .holdoutDays(result.getTestSamples())
            .mape(Precision.round(result.getMape(), 4))
            .smape(Precision.round(result.getSmape(), 4))
            .rmse(Precision.round(result.getRmse(), 4))
            .mae(Precision.round(result.getMae(), 4))
            .baselineMape(Precision.round(result.getBaselineMape(), 4))
            .baselineRmse(Precision.round(result.getBaselineRmse(), 4))
            .improvementPct(Precision.round(result.getImprovementPct(), 4))
            .trainStart(result.getTrainStart())
            .trainEnd(result.getTrainEnd())
            .trainSamples(result.getTrainSamples())
            .testSamples(result.getTestSamples())
            .params(result.getParams())
            .holdout(result.getHoldout().stream()
                .map(p -> BacktestResponse.HoldoutDay.builder()
                    .date(p.date())
                    .actual(Precision.round2(p.actual()))
                    .predicted(Precision.round2(p.predicted()))
                    .lowerBound(Precision.round2(p.lower()))
                    .upperBound(Precision.round2(p.upper()))
                    .build())
                .toList());
        if (selection != null) {
            Map<String, Double> candidateMape = new LinkedHashMap<>();
            selection.results().forEach(r -> candidateMape.put(r.getModelType().id(), Precision.round(r.getMape(), 4)));
            Map<String, String> excluded = new LinkedHashMap<>();
            selection.failures().forEach((type, reason) -> excluded.put(type.id(), reason));
            builder.candidateMape(candidateMape).excludedCandidates(excluded);
        }
        return builder.build();
    }

    static ForecastPointResponse toPointResponse(ForecastRecord r) {
        return ForecastPointResponse.builder()
            .date(r.getForecastDate())
            .metric(r.getMetricName())
            .predicted(r.getPredictedValue())
            .lowerBound(r.getLowerBound())
            .upperBound(r.getUpperBound())
            .confidenceLevel(r.getConfidenceLevel())
            .modelName(r.getModelName())
            .modelVersion(r.getModelVersion())
            .build();
    }

    private String toJson(Map<String, Object> params) {
        try {
            return mapper.writeValueAsString(params);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialize model parameters: " + ex.getOriginalMessage(), ex);
        }
    }
}
