package com.kpiforecast.repository;

import com.kpiforecast.entity.AnomalyKey;
import com.kpiforecast.entity.AnomalyRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public interface AnomalyRecordRepository extends JpaRepository<AnomalyRecord, AnomalyKey> {

    /** Newest day first, most severe first within a day; the limit applies after that ordering. */
    @Query(value = """
        SELECT * FROM ml_anomalies_daily
        ORDER BY anomaly_date DESC,
                 CASE severity
                     WHEN 'critical' THEN 1
                     WHEN 'high' THEN 2
                     WHEN 'medium' THEN 3
                     WHEN 'low' THEN 4
                     ELSE 5
                 END,
                 metric_name
        LIMIT :limit
    """, nativeQuery = true)
    List<AnomalyRecord> findLatest(@Param("limit") int limit);

    @Query("""
        SELECT a FROM AnomalyRecord a
        WHERE (a.acknowledged IS NULL OR a.acknowledged = false)
          AND a.anomalyDate >= :from
    """)
    List<AnomalyRecord> findUnacknowledgedSince(@Param("from") LocalDate from);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE AnomalyRecord a
        SET a.acknowledged = true,
            a.acknowledgedBy = :who,
            a.acknowledgedAt = :at,
            a.updatedAt = :at
        WHERE a.anomalyDate = :date
          AND a.metricName = :metric
    """)
    int acknowledge(@Param("date") LocalDate date,
                    @Param("metric") String metric,
                    @Param("who") String who,
                    @Param("at") Instant at);
}
