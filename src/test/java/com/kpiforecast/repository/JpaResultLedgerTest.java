package com.kpiforecast.repository;

import com.kpiforecast.entity.AnomalyKey;
import com.kpiforecast.entity.AnomalyRecord;
import com.kpiforecast.entity.BacktestPoint;
import com.kpiforecast.entity.ForecastKey;
import com.kpiforecast.entity.ForecastRecord;
import com.kpiforecast.entity.ModelRun;
import com.kpiforecast.ml.anomaly.AnomalyType;
import com.kpiforecast.ml.anomaly.Severity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DataJpaTest
@Import(JpaResultLedger.class)
@ActiveProfiles("test")
class JpaResultLedgerTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    @Autowired JpaResultLedger ledger;
    @Autowired ForecastRecordRepository forecastRepository;
    @Autowired AnomalyRecordRepository anomalyRepository;
    @Autowired ModelRunRepository runRepository;
    @Autowired BacktestPointRepository backtestRepository;

    private static ForecastRecord forecast(double predicted, long runId) {
        return ForecastRecord.builder()
            .forecastDate(DAY)
            .metricName("total_revenue")
            .predictedValue(predicted)
            .lowerBound(predicted - 10)
            .upperBound(predicted + 10)
            .confidenceLevel(0.8)
            .modelRunId(runId)
            .modelName("SeasonalTrend")
            .modelVersion("v2.0.0")
            .build();
    }

    private static AnomalyRecord anomaly(double actual) {
        return AnomalyRecord.builder()
            .anomalyDate(DAY)
            .metricName("total_orders")
            .actualValue(actual)
            .expectedValue(100)
            .deviationPct(actual - 100)
            .zScore(3.2)
            .anomalyType(actual > 100 ? AnomalyType.SPIKE : AnomalyType.DROP)
            .severity(Severity.HIGH)
            .weekend(false)
            .dayOfWeek(4)
            .businessInterpretation("text")
            .recommendedAction("action")
            .build();
    }

    private static ModelRun run(Double mape) {
        return ModelRun.builder()
            .modelType("forecast_seasonal_trend")
            .targetMetric("total_revenue")
            .trainStartDate(DAY.minusDays(60))
            .trainEndDate(DAY.minusDays(1))
            .trainSamples(60)
            .parameters("{}")
            .mape(mape)
            .status("completed")
            .createdBy("kpi-forecasting")
            .build();
    }

    @Test
    void upsertForecasts_replacesRowWithSameKey() {
        ledger.upsertForecasts(List.of(forecast(100, 1)));
        ledger.upsertForecasts(List.of(forecast(250, 2)));

        assertThat(forecastRepository.countByMetricName("total_revenue")).isEqualTo(1);
        ForecastRecord stored = forecastRepository.findById(new ForecastKey(DAY, "total_revenue")).orElseThrow();
        assertThat(stored.getPredictedValue()).isEqualTo(250);
        assertThat(stored.getModelRunId()).isEqualTo(2L);
        assertThat(stored.getUpdatedAt()).isNotNull();
    }

    @Test
    void upsertAnomalies_keepsExistingAcknowledgment() {
        ledger.upsertAnomalies(List.of(anomaly(140)));
        assertThat(ledger.acknowledge(DAY, "total_orders", "ops")).isEqualTo(1);

        ledger.upsertAnomalies(List.of(anomaly(160)));

        AnomalyRecord stored = anomalyRepository.findById(new AnomalyKey(DAY, "total_orders")).orElseThrow();
        assertThat(stored.getActualValue()).isEqualTo(160);
        assertThat(stored.isAcknowledged()).isTrue();
        assertThat(stored.getAcknowledgedBy()).isEqualTo("ops");
        assertThat(stored.getAcknowledgedAt()).isNotNull();
    }

    @Test
    void newAnomaly_startsUnacknowledged() {
        ledger.upsertAnomalies(List.of(anomaly(40)));

        assertThat(anomalyRepository.findUnacknowledgedSince(DAY.minusDays(7)))
            .singleElement()
            .satisfies(a -> {
                assertThat(a.getAcknowledged()).isFalse();
                assertThat(a.getAnomalyType()).isEqualTo(AnomalyType.DROP);
                assertThat(a.getSeverity()).isEqualTo(Severity.HIGH);
            });
    }

    @Test
    void acknowledge_missingRow_affectsNothing() {
        assertThat(ledger.acknowledge(DAY, "total_orders", "ops")).isZero();
    }

    @Test
    void emptyBatches_writeNothing() {
        assertThat(ledger.upsertForecasts(List.of())).isZero();
        assertThat(ledger.upsertAnomalies(List.of())).isZero();
        assertThat(forecastRepository.count()).isZero();
    }

    @Test
    void recordRun_assignsIncreasingIds_andStoresBacktestPoints() {
        long first = ledger.recordRun(run(null));
        long second = ledger.recordRun(run(4.2));

        assertThat(second).isGreaterThan(first);
        assertThat(runRepository.findById(first).orElseThrow().getMape()).isNull();

        ledger.recordBacktestPoints(second, List.of(
            BacktestPoint.builder().runId(second).predictionDate(DAY.plusDays(1))
                .actualValue(100).predictedValue(90).lowerBound(80).upperBound(110)
                .absoluteError(10).percentageError(10.0).withinInterval(true).build(),
            BacktestPoint.builder().runId(second).predictionDate(DAY)
                .actualValue(0).predictedValue(5).lowerBound(0).upperBound(10)
                .absoluteError(5).percentageError(null).withinInterval(true).build()));

        List<BacktestPoint> points = backtestRepository.findByRunIdOrderByPredictionDateAsc(second);
        assertThat(points).extracting(BacktestPoint::getPredictionDate).containsExactly(DAY, DAY.plusDays(1));
        assertThat(points.get(0).getPercentageError()).isNull();
    }

    @Test
    void findLatest_limitsAfterOrderingBySeverityWithinDay() {
        ledger.upsertAnomalies(List.of(
            anomalyOn(DAY, "total_revenue", Severity.LOW),
            anomalyOn(DAY, "total_orders", Severity.CRITICAL),
            anomalyOn(DAY, "unique_customers", Severity.MEDIUM),
            anomalyOn(DAY.minusDays(1), "total_revenue", Severity.CRITICAL)));

        List<AnomalyRecord> latest = anomalyRepository.findLatest(2);

        assertThat(latest).extracting(AnomalyRecord::getAnomalyDate, AnomalyRecord::getSeverity)
            .containsExactly(
                tuple(DAY, Severity.CRITICAL),
                tuple(DAY, Severity.MEDIUM));
    }

    private static AnomalyRecord anomalyOn(LocalDate date, String metric, Severity severity) {
        return AnomalyRecord.builder()
            .anomalyDate(date)
            .metricName(metric)
            .actualValue(10)
            .expectedValue(100)
            .anomalyType(AnomalyType.DROP)
            .severity(severity)
            .build();
    }
}
