package com.kpiforecast.repository;

import com.kpiforecast.entity.AnomalyRecord;
import com.kpiforecast.entity.BacktestPoint;
import com.kpiforecast.entity.ForecastRecord;
import com.kpiforecast.entity.ModelRun;

import java.time.LocalDate;
import java.util.List;

/**
 * Write side of the forecasting tables. Forecast and anomaly rows are keyed by (date, metric) and
 * merged on conflict; model runs and backtest points are append-only.
 */
public interface ResultLedger {

    /** Inserts the run and returns its generated id. */
    long recordRun(ModelRun run);

    void recordBacktestPoints(long runId, List<BacktestPoint> points);

    int upsertForecasts(List<ForecastRecord> records);

    /** Acknowledgment fields are only overwritten when the incoming record carries a non-null value. */
    int upsertAnomalies(List<AnomalyRecord> records);

    /** @return rows affected; 0 when no anomaly exists for the key */
    int acknowledge(LocalDate date, String metric, String acknowledgedBy);
}
