package com.kpiforecast.repository;

import com.kpiforecast.entity.AnomalyKey;
import com.kpiforecast.entity.AnomalyRecord;
import com.kpiforecast.entity.BacktestPoint;
import com.kpiforecast.entity.ForecastKey;
import com.kpiforecast.entity.ForecastRecord;
import com.kpiforecast.entity.ModelRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.function.Supplier;

/**
 * Upserts run as find-then-update-or-insert inside one short transaction per batch. The primary
 * key is the safety net: a concurrent insert of the same key fails the batch, which is then
 * replayed and finds the row on the next attempt.
 */
@Slf4j
@Component
public class JpaResultLedger implements ResultLedger {

    private final ModelRunRepository runRepository;
    private final BacktestPointRepository backtestRepository;
    private final ForecastRecordRepository forecastRepository;
    private final AnomalyRecordRepository anomalyRepository;
    private final TransactionTemplate transactionTemplate;

    @Value("${persistence.upsert-max-attempts:3}")
    private int maxAttempts = 3;

    public JpaResultLedger(ModelRunRepository runRepository,
                           BacktestPointRepository backtestRepository,
                           ForecastRecordRepository forecastRepository,
                           AnomalyRecordRepository anomalyRepository,
                           PlatformTransactionManager transactionManager) {
        this.runRepository = runRepository;
        this.backtestRepository = backtestRepository;
        this.forecastRepository = forecastRepository;
        this.anomalyRepository = anomalyRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public long recordRun(ModelRun run) {
        ModelRun saved = transactionTemplate.execute(status -> runRepository.saveAndFlush(run));
        log.info("Model run recorded | runId={} | type={} | metric={} | mape={}",
                 saved.getRunId(), saved.getModelType(), saved.getTargetMetric(), saved.getMape());
        return saved.getRunId();
    }

    @Override
    public void recordBacktestPoints(long runId, List<BacktestPoint> points) {
        if (points.isEmpty()) {
            return;
        }
        transactionTemplate.executeWithoutResult(status -> backtestRepository.saveAll(points));
        log.debug("Backtest points recorded | runId={} | rows={}", runId, points.size());
    }

    @Override
    public int upsertForecasts(List<ForecastRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        return withRetry("forecasts", () -> transactionTemplate.execute(status -> {
            Instant now = Instant.now();
            for (ForecastRecord incoming : records) {
                ForecastKey key = new ForecastKey(incoming.getForecastDate(), incoming.getMetricName());
                ForecastRecord row = forecastRepository.findById(key).orElse(null);
                if (row == null) {
                    row = ForecastRecord.builder()
                        .forecastDate(incoming.getForecastDate())
                        .metricName(incoming.getMetricName())
                        .build();
                }
                row.overwriteValues(incoming);
                row.setUpdatedAt(now);
                forecastRepository.save(row);
            }
            forecastRepository.flush();
            return records.size();
        }));
    }

    @Override
    public int upsertAnomalies(List<AnomalyRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        return withRetry("anomalies", () -> transactionTemplate.execute(status -> {
            Instant now = Instant.now();
            for (AnomalyRecord incoming : records) {
                AnomalyKey key = new AnomalyKey(incoming.getAnomalyDate(), incoming.getMetricName());
                AnomalyRecord row = anomalyRepository.findById(key).orElse(null);
                if (row == null) {
                    row = AnomalyRecord.builder()
                        .anomalyDate(incoming.getAnomalyDate())
                        .metricName(incoming.getMetricName())
                        .acknowledged(false)
                        .build();
                }
                row.overwriteValues(incoming);
                row.setUpdatedAt(now);
                anomalyRepository.save(row);
            }
            anomalyRepository.flush();
            return records.size();
        }));
    }

    @Override
    public int acknowledge(LocalDate date, String metric, String acknowledgedBy) {
        Integer affected = transactionTemplate.execute(
            status -> anomalyRepository.acknowledge(date, metric, acknowledgedBy, Instant.now()));
        int count = affected != null ? affected : 0;
        log.info("Anomaly acknowledged | date={} | metric={} | by={} | rows={}",
                 date, metric, acknowledgedBy, count);
        return count;
    }

    private int withRetry(String table, Supplier<Integer> batch) {
        int attempts = Math.max(1, maxAttempts);
        for (int attempt = 1; ; attempt++) {
            try {
                Integer written = batch.get();
                log.info("Upsert committed | table={} | rows={} | attempt={}", table, written, attempt);
                return written != null ? written : 0;
            } catch (DataIntegrityViolationException ex) {
                if (attempt >= attempts) {
                    throw ex;
                }
                log.warn("Upsert conflict, retrying | table={} | attempt={} | reason={}",
                         table, attempt, ex.getMostSpecificCause().getMessage());
            }
        }
    }
}
