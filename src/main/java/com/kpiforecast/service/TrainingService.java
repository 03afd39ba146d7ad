package com.kpiforecast.service;

import com.kpiforecast.dto.AnomalyResponse;
import com.kpiforecast.dto.ForecastResponse;
import com.kpiforecast.dto.TrainResponse;
import com.kpiforecast.entity.DailyKpi;
import com.kpiforecast.entity.KpiMetric;
import com.kpiforecast.ml.DailySeries;
import com.kpiforecast.ml.SeriesPreparer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Batch retraining: for each metric, select and record a model, forecast the longest configured
 * horizon (shorter horizons are its prefixes) and scan the full history for anomalies.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingService {

    private final MetricHistoryService history;
    private final ForecastingService forecastingService;
    private final AnomalyService anomalyService;

    @Value("${forecasting.train-metrics:total_revenue,total_orders}")
    private String[] defaultMetrics;

    @Value("${forecasting.train-horizons:7,30}")
    private int[] horizons;

    @Value("${anomaly.default-contamination:0.1}")
    private double contamination;

    public TrainResponse trainAll(List<String> metrics) {
        List<String> requested = metrics == null || metrics.isEmpty() ? Arrays.asList(defaultMetrics) : metrics;
        List<KpiMetric> kpis = requested.stream().map(history::resolveMetric).distinct().toList();
        int horizon = Arrays.stream(horizons).max()
            .orElseThrow(() -> new IllegalStateException("forecasting.train-horizons must not be empty"));

        List<DailyKpi> rows = history.readAll("training");

        int forecasts = 0;
        int anomalies = 0;
        Map<String, Long> forecastRuns = new LinkedHashMap<>();
        Map<String, Long> anomalyRuns = new LinkedHashMap<>();
        Map<String, String> models = new LinkedHashMap<>();

        for (KpiMetric kpi : kpis) {
            log.info("Training started | metric={} | horizon={} | rows={}", kpi.columnName(), horizon, rows.size());
            DailySeries series = SeriesPreparer.prepare(MetricHistoryService.observations(rows, kpi));

            ForecastResponse forecast = forecastingService.runForecast(kpi, series, horizon, null);
            forecasts += forecast.getForecasts().size();
            forecastRuns.put(kpi.columnName(), forecast.getRunId());
            models.put(kpi.columnName(), forecast.getModelName());

            AnomalyResponse scan = anomalyService.scanHistory(kpi, rows, contamination);
            anomalies += scan.getAnomaliesFound();
            if (scan.getRunId() != null) {
                anomalyRuns.put(kpi.columnName(), scan.getRunId());
            }
        }

        log.info("Training finished | metrics={} | forecasts={} | anomalies={}",
                 kpis.size(), forecasts, anomalies);
        return TrainResponse.builder()
            .status("success")
            .metricsTrained(kpis.stream().map(KpiMetric::columnName).toList())
            .forecastsGenerated(forecasts)
            .anomaliesDetected(anomalies)
            .forecastRunIds(forecastRuns)
            .anomalyRunIds(anomalyRuns)
            .models(models)
            .build();
    }
}
