package com.kpiforecast.repository;

import com.kpiforecast.entity.ForecastKey;
import com.kpiforecast.entity.ForecastRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaResultLedgerRetryTest {

    @Mock ModelRunRepository runRepository;
    @Mock BacktestPointRepository backtestRepository;
    @Mock ForecastRecordRepository forecastRepository;
    @Mock AnomalyRecordRepository anomalyRepository;
    @Mock PlatformTransactionManager transactionManager;

    private JpaResultLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new JpaResultLedger(runRepository, backtestRepository, forecastRepository,
                                     anomalyRepository, transactionManager);
        ReflectionTestUtils.setField(ledger, "maxAttempts", 3);
    }

    private static List<ForecastRecord> batch() {
        return List.of(ForecastRecord.builder()
            .forecastDate(LocalDate.of(2024, 3, 1))
            .metricName("total_revenue")
            .predictedValue(120)
            .build());
    }

    @Test
    void upsertForecasts_keyCollision_isReplayed() {
        when(forecastRepository.findById(any(ForecastKey.class))).thenReturn(Optional.empty());
        when(forecastRepository.save(any(ForecastRecord.class)))
            .thenThrow(new DataIntegrityViolationException("duplicate key"))
            .thenAnswer(inv -> inv.getArgument(0));

        assertThat(ledger.upsertForecasts(batch())).isEqualTo(1);

        verify(forecastRepository, times(2)).save(any(ForecastRecord.class));
        verify(transactionManager).rollback(any());
        verify(forecastRepository).flush();
    }

    @Test
    void upsertForecasts_persistentCollision_rethrowsAfterLastAttempt() {
        when(forecastRepository.findById(any(ForecastKey.class))).thenReturn(Optional.empty());
        when(forecastRepository.save(any(ForecastRecord.class)))
            .thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertThatThrownBy(() -> ledger.upsertForecasts(batch()))
            .isInstanceOf(DataIntegrityViolationException.class)
            .hasMessageContaining("duplicate key");

        verify(forecastRepository, times(3)).save(any(ForecastRecord.class));
        verify(forecastRepository, never()).flush();
    }
}
