package com.kpiforecast.service;

import com.kpiforecast.dto.ForecastPointResponse;
import com.kpiforecast.dto.HealthResponse;
import com.kpiforecast.dto.ModelRunResponse;
import com.kpiforecast.entity.ModelRun;
import com.kpiforecast.repository.DailyKpiRepository;
import com.kpiforecast.repository.ForecastRecordRepository;
import com.kpiforecast.repository.ModelRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/** Read side: persisted forecasts, the run ledger and data-source health. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportingService {

    private final ForecastRecordRepository forecastRepository;
    private final ModelRunRepository runRepository;
    private final DailyKpiRepository kpiRepository;

    @Value("${forecasting.model-version:2.0.0}")
    private String modelVersion;

    /** Forecasts dated today or later, grouped by metric then date. */
    @Transactional(readOnly = true)
    public List<ForecastPointResponse> latestForecasts() {
        return forecastRepository
            .findByForecastDateGreaterThanEqualOrderByMetricNameAscForecastDateAsc(LocalDate.now())
            .stream()
            .map(ForecastingService::toPointResponse)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<ModelRunResponse> recentRuns(int limit) {
        return runRepository.findAllByOrderByRunIdDesc(PageRequest.of(0, Math.max(1, limit)))
            .stream()
            .map(ReportingService::toResponse)
            .toList();
    }

    public HealthResponse health() {
        try {
            long total = kpiRepository.count();
            LocalDate last = kpiRepository.findLatestDate().orElse(null);
            return HealthResponse.builder()
                .status(total > 0 ? "healthy" : "degraded")
                .databaseConnected(true)
                .lastDataDate(last)
                .totalRecords(total)
                .version(modelVersion)
                .build();
        } catch (DataAccessException ex) {
            log.warn("Health check failed | reason={}", ex.getMostSpecificCause().getMessage());
            return HealthResponse.builder()
                .status("unhealthy")
                .databaseConnected(false)
                .totalRecords(0)
                .version(modelVersion)
                .build();
        }
    }

    static ModelRunResponse toResponse(ModelRun run) {
        return ModelRunResponse.builder()
            .runId(run.getRunId())
            .runTimestamp(run.getRunTimestamp())
            .modelType(run.getModelType())
            .targetMetric(run.getTargetMetric())
            .trainStart(run.getTrainStartDate())
            .trainEnd(run.getTrainEndDate())
            .trainSamples(run.getTrainSamples())
            .mape(run.getMape())
            .smape(run.getSmape())
            .rmse(run.getRmse())
            .mae(run.getMae())
            .baselineMape(run.getBaselineMape())
            .baselineRmse(run.getBaselineRmse())
            .improvementPct(run.getImprovementPct())
            .modelVersion(run.getModelVersion())
            .codeVersion(run.getCodeVersion())
            .status(run.getStatus())
            .createdBy(run.getCreatedBy())
            .build();
    }
}
