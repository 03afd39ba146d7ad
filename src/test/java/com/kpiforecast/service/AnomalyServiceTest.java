package com.kpiforecast.service;

import com.kpiforecast.dto.AcknowledgeResponse;
import com.kpiforecast.dto.AnomalyRecordResponse;
import com.kpiforecast.dto.AnomalyResponse;
import com.kpiforecast.entity.AnomalyRecord;
import com.kpiforecast.entity.KpiMetric;
import com.kpiforecast.entity.ModelRun;
import com.kpiforecast.exception.InvalidMetricException;
import com.kpiforecast.ml.anomaly.AnomalyDetector;
import com.kpiforecast.ml.anomaly.AnomalyType;
import com.kpiforecast.ml.anomaly.RandomCutForestScorer;
import com.kpiforecast.ml.anomaly.Severity;
import com.kpiforecast.repository.AnomalyRecordRepository;
import com.kpiforecast.repository.MetricSeriesReader;
import com.kpiforecast.repository.ResultLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnomalyServiceTest {

    @Mock MetricSeriesReader reader;
    @Mock ResultLedger ledger;
    @Mock AnomalyRecordRepository anomalyRepository;

    private AnomalyService service;

    @BeforeEach
    void setUp() {
        AnomalyDetector detector = new AnomalyDetector(new RandomCutForestScorer(50, 256, 42));
        service = new AnomalyService(new MetricHistoryService(reader), detector, ledger, anomalyRepository);
        ReflectionTestUtils.setField(service, "modelVersion", "2.0.0");
        ReflectionTestUtils.setField(service, "codeVersion", "test");
    }

    private static AnomalyRecord stored(LocalDate date, Severity severity) {
        return AnomalyRecord.builder()
            .anomalyDate(date)
            .metricName("total_revenue")
            .actualValue(10)
            .expectedValue(100)
            .anomalyType(AnomalyType.DROP)
            .severity(severity)
            .build();
    }

    @Test
    void detectAnomalies_scansLookbackWindowAndPersists() {
        // 2024-02-15, a Thursday inside the last 30 days
        when(reader.readAll()).thenReturn(KpiRows.daily(60, i -> i == 45 ? 1000.0 : 100.0));
        when(ledger.recordRun(any(ModelRun.class))).thenReturn(5L);
        when(ledger.upsertAnomalies(anyList())).thenAnswer(inv -> ((List<?>) inv.getArgument(0)).size());

        AnomalyResponse response = service.detectAnomalies("total_revenue", 30, 0.1);

        assertThat(response.getRunId()).isEqualTo(5L);
        assertThat(response.getTotalChecked()).isEqualTo(31);
        assertThat(response.getAnomaliesFound()).isEqualTo(response.getAnomalies().size());
        assertThat(response.getAnomalies()).anySatisfy(a -> {
            assertThat(a.getDate()).isEqualTo(LocalDate.of(2024, 2, 15));
            assertThat(a.getAnomalyType()).isEqualTo("spike");
            assertThat(a.getSeverity()).isEqualTo("critical");
            assertThat(a.getDeviationPct()).isEqualTo(207.69);
            assertThat(a.isAcknowledged()).isFalse();
        });

        ArgumentCaptor<ModelRun> run = ArgumentCaptor.forClass(ModelRun.class);
        verify(ledger).recordRun(run.capture());
        assertThat(run.getValue().getModelType()).isEqualTo(AnomalyService.RUN_TYPE);
        assertThat(run.getValue().getTrainSamples()).isEqualTo(31);
        assertThat(run.getValue().getTrainStartDate()).isEqualTo(LocalDate.of(2024, 1, 30));
        assertThat(run.getValue().getTrainEndDate()).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(run.getValue().getParameters()).contains("\"lookback_days\":30", "\"contamination\":0.1");
    }

    @Test
    void detectAnomalies_persistedRecordsLeaveAcknowledgmentUntouched() {
        when(reader.readAll()).thenReturn(KpiRows.daily(60, i -> i == 45 ? 1000.0 : 100.0));
        when(ledger.recordRun(any(ModelRun.class))).thenReturn(5L);
        when(ledger.upsertAnomalies(anyList())).thenAnswer(inv -> ((List<?>) inv.getArgument(0)).size());

        service.detectAnomalies("total_revenue", 30, 0.1);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<AnomalyRecord>> records = ArgumentCaptor.forClass(List.class);
        verify(ledger).upsertAnomalies(records.capture());
        assertThat(records.getValue()).isNotEmpty().allSatisfy(r -> {
            assertThat(r.getAcknowledged()).isNull();
            assertThat(r.getModelRunId()).isEqualTo(5L);
        });
    }

    @Test
    void detectAnomalies_shortWindow_returnsEmptyWithoutRun() {
        when(reader.readAll()).thenReturn(KpiRows.daily(60, i -> 100.0));

        AnomalyResponse response = service.detectAnomalies("total_revenue", 10, 0.1);

        assertThat(response.getTotalChecked()).isEqualTo(11);
        assertThat(response.getAnomalies()).isEmpty();
        assertThat(response.getRunId()).isNull();
        verifyNoInteractions(ledger);
    }

    @Test
    void detectAnomalies_unknownMetric_isRejected() {
        assertThatThrownBy(() -> service.detectAnomalies("refunds", 30, 0.1))
            .isInstanceOf(InvalidMetricException.class);
        verifyNoInteractions(reader, ledger);
    }

    @Test
    void scanHistory_coversEveryRow() {
        when(ledger.recordRun(any(ModelRun.class))).thenReturn(9L);

        AnomalyResponse response = service.scanHistory(
            KpiMetric.TOTAL_ORDERS, KpiRows.daily(40, i -> 100.0), 0.1);

        assertThat(response.getTotalChecked()).isEqualTo(40);
        assertThat(response.getRunId()).isEqualTo(9L);
        assertThat(response.getAnomalies()).isEmpty();
    }

    @Test
    void latest_keepsRepositoryOrderAndClampsLimit() {
        LocalDate day = LocalDate.of(2024, 5, 10);
        when(anomalyRepository.findLatest(1)).thenReturn(List.of(
            stored(day, Severity.CRITICAL),
            stored(day.minusDays(1), Severity.LOW)));

        List<AnomalyRecordResponse> latest = service.latest(0);

        assertThat(latest).extracting(AnomalyRecordResponse::getDate, AnomalyRecordResponse::getSeverity)
            .containsExactly(
                tuple(day, "critical"),
                tuple(day.minusDays(1), "low"));
    }

    @Test
    void active_ordersBySeverityThenNewest() {
        LocalDate today = LocalDate.now();
        when(anomalyRepository.findUnacknowledgedSince(today.minusDays(7))).thenReturn(List.of(
            stored(today, Severity.LOW),
            stored(today.minusDays(2), Severity.HIGH),
            stored(today.minusDays(1), Severity.HIGH)));

        List<AnomalyRecordResponse> active = service.active();

        assertThat(active).extracting(AnomalyRecordResponse::getDate)
            .containsExactly(today.minusDays(1), today.minusDays(2), today);
    }

    @Test
    void acknowledge_defaultsToAnalyst() {
        LocalDate day = LocalDate.of(2024, 5, 10);
        when(ledger.acknowledge(day, "total_revenue", "analyst")).thenReturn(1);

        AcknowledgeResponse response = service.acknowledge(day, "total_revenue", " ");

        assertThat(response.getAcknowledgedBy()).isEqualTo("analyst");
        assertThat(response.getUpdated()).isEqualTo(1);
    }
}
