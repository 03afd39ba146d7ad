package com.kpiforecast.controller;

import com.kpiforecast.config.RequestIdFilter;
import com.kpiforecast.dto.AcknowledgeResponse;
import com.kpiforecast.dto.AnomalyRecordResponse;
import com.kpiforecast.dto.AnomalyRequest;
import com.kpiforecast.dto.AnomalyResponse;
import com.kpiforecast.dto.AsyncJobResponse;
import com.kpiforecast.dto.BacktestResponse;
import com.kpiforecast.dto.ForecastPointResponse;
import com.kpiforecast.dto.ForecastRequest;
import com.kpiforecast.dto.ForecastResponse;
import com.kpiforecast.dto.HealthResponse;
import com.kpiforecast.dto.ModelRunResponse;
import com.kpiforecast.dto.TrainRequest;
import com.kpiforecast.dto.TrainResponse;
import com.kpiforecast.service.AnomalyService;
import com.kpiforecast.service.AsyncJobService;
import com.kpiforecast.service.ForecastingService;
import com.kpiforecast.service.ReportingService;
import com.kpiforecast.service.TrainingService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ForecastController {

    private final ForecastingService forecastingService;
    private final AnomalyService anomalyService;
    private final TrainingService trainingService;
    private final ReportingService reportingService;
    private final AsyncJobService asyncJobService;

    @PostMapping("/forecasts")
    public ResponseEntity<ForecastResponse> forecast(
            @Valid @RequestBody ForecastRequest request, HttpServletRequest httpRequest) {
        log.info("POST /forecasts | metric={} | days={} | model={} | requestId={}",
                 request.getMetric(), request.getForecastDays(), request.getModel(), requestId(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(forecastingService.forecast(request.getMetric(), request.getForecastDays(), request.getModel()));
    }

    @PostMapping("/anomalies")
    public ResponseEntity<AnomalyResponse> detectAnomalies(
            @Valid @RequestBody AnomalyRequest request, HttpServletRequest httpRequest) {
        log.info("POST /anomalies | metric={} | lookbackDays={} | contamination={} | requestId={}",
                 request.getMetric(), request.getLookbackDays(), request.getContamination(), requestId(httpRequest));
        return ResponseEntity.ok(anomalyService.detectAnomalies(
            request.getMetric(), request.getLookbackDays(), request.getContamination()));
    }

    @PostMapping("/backtests/{metric}")
    public ResponseEntity<BacktestResponse> backtest(
            @PathVariable String metric,
            @RequestParam(defaultValue = "auto") String model,
            @RequestParam(defaultValue = "14") @Min(1) @Max(365) int holdoutDays) {
        log.info("POST /backtests/{} | model={} | holdoutDays={}", metric, model, holdoutDays);
        return ResponseEntity.ok(forecastingService.backtest(metric, model, holdoutDays));
    }

    @PostMapping("/train")
    public ResponseEntity<TrainResponse> train(
            @RequestBody(required = false) TrainRequest request, HttpServletRequest httpRequest) {
        List<String> metrics = request != null ? request.getMetrics() : null;
        log.info("POST /train | metrics={} | requestId={}", metrics, requestId(httpRequest));
        return ResponseEntity.ok(trainingService.trainAll(metrics));
    }

    @PostMapping("/train/async")
    public ResponseEntity<AsyncJobResponse> trainAsync(
            @RequestBody(required = false) TrainRequest request, HttpServletRequest httpRequest) {
        List<String> metrics = request != null ? request.getMetrics() : null;
        String requestId = requestId(httpRequest);
        UUID jobId = asyncJobService.submit("TRAIN_ALL", requestId, () -> trainingService.trainAll(metrics));
        return ResponseEntity.accepted()
            .header("Location", "/api/v1/jobs/" + jobId)
            .body(asyncJobService.getJob(jobId));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(asyncJobService.getJob(jobId));
    }

    @GetMapping("/forecasts/latest")
    public ResponseEntity<List<ForecastPointResponse>> latestForecasts() {
        return ResponseEntity.ok(reportingService.latestForecasts());
    }

    @GetMapping("/anomalies/latest")
    public ResponseEntity<List<AnomalyRecordResponse>> latestAnomalies(
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(anomalyService.latest(limit));
    }

    @GetMapping("/anomalies/active")
    public ResponseEntity<List<AnomalyRecordResponse>> activeAnomalies() {
        return ResponseEntity.ok(anomalyService.active());
    }

    @PostMapping("/anomalies/{date}/{metric}/acknowledge")
    public ResponseEntity<AcknowledgeResponse> acknowledge(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @PathVariable String metric,
            @RequestParam(defaultValue = "analyst") String acknowledgedBy) {
        log.info("POST /anomalies/{}/{}/acknowledge | by={}", date, metric, acknowledgedBy);
        return ResponseEntity.ok(anomalyService.acknowledge(date, metric, acknowledgedBy));
    }

    @GetMapping("/model-runs")
    public ResponseEntity<List<ModelRunResponse>> modelRuns(
            @RequestParam(defaultValue = "20") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(reportingService.recentRuns(limit));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(reportingService.health());
    }

    private static String requestId(HttpServletRequest request) {
        return request.getHeader(RequestIdFilter.HEADER);
    }
}
