package com.kpiforecast.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kpiforecast.dto.AcknowledgeResponse;
import com.kpiforecast.dto.AnomalyRecordResponse;
import com.kpiforecast.dto.AnomalyResponse;
import com.kpiforecast.entity.AnomalyRecord;
import com.kpiforecast.entity.DailyKpi;
import com.kpiforecast.entity.KpiMetric;
import com.kpiforecast.entity.ModelRun;
import com.kpiforecast.ml.MetricObservation;
import com.kpiforecast.ml.Precision;
import com.kpiforecast.ml.anomaly.AnomalyDetector;
import com.kpiforecast.ml.anomaly.AnomalyFinding;
import com.kpiforecast.repository.AnomalyRecordRepository;
import com.kpiforecast.repository.ResultLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyService {

    static final String RUN_TYPE = "anomaly_outlier_ensemble";
    static final String DEFAULT_ACKNOWLEDGER = "analyst";
    static final int ACTIVE_WINDOW_DAYS = 7;

    private static final Comparator<AnomalyRecord> BY_PRIORITY =
        Comparator.comparingInt(a -> a.getSeverity() == null ? Integer.MAX_VALUE : a.getSeverity().priority());
    private static final Comparator<AnomalyRecord> NEWEST_FIRST =
        Comparator.comparing(AnomalyRecord::getAnomalyDate).reversed();

    private final MetricHistoryService history;
    private final AnomalyDetector detector;
    private final ResultLedger ledger;
    private final AnomalyRecordRepository anomalyRepository;
    private final ObjectMapper mapper = new ObjectMapper();

    @Value("${forecasting.model-version:2.0.0}")
    private String modelVersion;

    @Value("${forecasting.code-version:2024.01.1}")
    private String codeVersion;

    /**
     * Scans the days in {@code [maxDate - lookbackDays, maxDate]} and persists every flagged day.
     * Fewer than 14 days in the window yields an empty result and writes nothing.
     */
    public AnomalyResponse detectAnomalies(String metric, int lookbackDays, double contamination) {
        KpiMetric kpi = history.resolveMetric(metric);
        if (lookbackDays < 1) {
            throw new IllegalArgumentException("lookbackDays must be >= 1");
        }
        List<DailyKpi> rows = history.readAll("anomaly detection");
        LocalDate cutoff = rows.get(rows.size() - 1).getFullDate().minusDays(lookbackDays);
        List<DailyKpi> window = rows.stream()
            .filter(r -> !r.getFullDate().isBefore(cutoff))
            .toList();

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("lookback_days", lookbackDays);
        return scan(kpi, MetricHistoryService.observations(window, kpi), contamination, params, window.size());
    }

    /** Full-history scan used by batch training. */
    public AnomalyResponse scanHistory(KpiMetric kpi, List<DailyKpi> rows, double contamination) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("lookback_days", "all");
        return scan(kpi, MetricHistoryService.observations(rows, kpi), contamination, params, rows.size());
    }

    private AnomalyResponse scan(KpiMetric kpi, List<MetricObservation> observations, double contamination,
                                 Map<String, Object> params, int totalChecked) {
        List<AnomalyFinding> findings = detector.detect(observations, kpi.columnName(), contamination);
        Long runId = null;
        List<AnomalyRecord> records = List.of();

        if (observations.size() >= AnomalyDetector.MIN_OBSERVATIONS) {
            params.put("contamination", contamination);
            params.put("z_threshold", AnomalyDetector.Z_THRESHOLD);
            params.put("rolling_window", AnomalyDetector.ROLLING_WINDOW);
            params.put("rolling_min_periods", AnomalyDetector.ROLLING_MIN_PERIODS);
            params.put("scorer", "random_cut_forest");
            runId = ledger.recordRun(anomalyRun(kpi, observations, params, findings.size()));

            Long recordRunId = runId;
            records = findings.stream().map(f -> toRecord(f, recordRunId)).toList();
            int written = ledger.upsertAnomalies(records);
            log.info("Anomalies saved | metric={} | checked={} | rows={} | runId={}",
                     kpi.columnName(), totalChecked, written, runId);
        } else {
            log.info("Anomaly scan skipped | metric={} | observations={} | required={}",
                     kpi.columnName(), observations.size(), AnomalyDetector.MIN_OBSERVATIONS);
        }

        return AnomalyResponse.builder()
            .metric(kpi.columnName())
            .anomalies(records.stream().map(AnomalyService::toResponse).toList())
            .totalChecked(totalChecked)
            .anomaliesFound(records.size())
            .runId(runId)
            .createdAt(Instant.now())
            .build();
    }

    /** The most recent anomalies, newest day first, most severe first within a day. */
    @Transactional(readOnly = true)
    public List<AnomalyRecordResponse> latest(int limit) {
        return anomalyRepository.findLatest(Math.max(1, limit))
            .stream()
            .map(AnomalyService::toResponse)
            .toList();
    }

    /** Unacknowledged anomalies of the last seven days, most severe first. */
    @Transactional(readOnly = true)
    public List<AnomalyRecordResponse> active() {
        LocalDate from = LocalDate.now().minusDays(ACTIVE_WINDOW_DAYS);
        return anomalyRepository.findUnacknowledgedSince(from)
            .stream()
            .sorted(BY_PRIORITY.thenComparing(NEWEST_FIRST))
            .map(AnomalyService::toResponse)
            .toList();
    }

    public AcknowledgeResponse acknowledge(LocalDate date, String metric, String acknowledgedBy) {
        String who = acknowledgedBy == null || acknowledgedBy.isBlank() ? DEFAULT_ACKNOWLEDGER : acknowledgedBy;
        int updated = ledger.acknowledge(date, metric, who);
        return AcknowledgeResponse.builder()
            .date(date)
            .metric(metric)
            .acknowledgedBy(who)
            .updated(updated)
            .build();
    }

    private ModelRun anomalyRun(KpiMetric kpi, List<MetricObservation> observations,
                                Map<String, Object> params, int flagged) {
        LocalDate start = observations.stream().map(MetricObservation::date).min(LocalDate::compareTo).orElseThrow();
        LocalDate end = observations.stream().map(MetricObservation::date).max(LocalDate::compareTo).orElseThrow();
        return ModelRun.builder()
            .modelType(RUN_TYPE)
            .targetMetric(kpi.columnName())
            .trainStartDate(start)
            .trainEndDate(end)
            .trainSamples(observations.size())
            .parameters(toJson(params))
            .modelVersion(modelVersion)
            .codeVersion(codeVersion)
            .status(ForecastingService.STATUS_COMPLETED)
            .createdBy(ForecastingService.CREATED_BY)
            .notes("Flagged " + flagged + " of " + observations.size() + " days")
            .build();
    }

    static AnomalyRecord toRecord(AnomalyFinding f, Long runId) {
        return AnomalyRecord.builder()
            .anomalyDate(f.date())
            .metricName(f.metric())
            .actualValue(Precision.round2(f.actual()))
            .expectedValue(Precision.round2(f.expected()))
            .deviationPct(f.deviationPct())
            .zScore(Precision.round2(f.zScore()))
            .anomalyType(f.type())
            .severity(f.severity())
            .weekend(f.weekend())
            .dayOfWeek(f.dayOfWeek())
            .businessInterpretation(f.businessInterpretation())
            .recommendedAction(f.recommendedAction())
            .modelRunId(runId)
            .build();
    }

    static AnomalyRecordResponse toResponse(AnomalyRecord r) {
        return AnomalyRecordResponse.builder()
            .date(r.getAnomalyDate())
            .metric(r.getMetricName())
            .actual(r.getActualValue())
            .expected(r.getExpectedValue())
            .deviationPct(r.getDeviationPct())
            .zScore(r.getZScore())
            .anomalyType(r.getAnomalyType() != null ? r.getAnomalyType().label() : null)
            .severity(r.getSeverity() != null ? r.getSeverity().label() : null)
            .weekend(r.isWeekend())
            .dayOfWeek(r.getDayOfWeek())
            .businessInterpretation(r.getBusinessInterpretation())
            .recommendedAction(r.getRecommendedAction())
            .acknowledged(r.isAcknowledged())
            .acknowledgedBy(r.getAcknowledgedBy())
            .acknowledgedAt(r.getAcknowledgedAt())
            .build();
    }

    private String toJson(Map<String, Object> params) {
        try {
            return mapper.writeValueAsString(params);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialize detector parameters: " + ex.getOriginalMessage(), ex);
        }
    }
}
