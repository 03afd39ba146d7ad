package com.kpiforecast.repository;

import com.kpiforecast.entity.ForecastKey;
import com.kpiforecast.entity.ForecastRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;

public interface ForecastRecordRepository extends JpaRepository<ForecastRecord, ForecastKey> {

    List<ForecastRecord> findByForecastDateGreaterThanEqualOrderByMetricNameAscForecastDateAsc(LocalDate from);

    long countByMetricName(String metricName);
}
