package com.kpiforecast.entity;

import com.kpiforecast.ml.anomaly.AnomalyType;
import com.kpiforecast.ml.anomaly.Severity;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@IdClass(AnomalyKey.class)
@Table(
    name = "ml_anomalies_daily",
    indexes = {
        @Index(name = "idx_anomaly_metric", columnList = "metric_name"),
        @Index(name = "idx_anomaly_ack",    columnList = "acknowledged"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnomalyRecord {

    @Id
    @Column(name = "anomaly_date", nullable = false)
    private LocalDate anomalyDate;

    @Id
    @Column(name = "metric_name", nullable = false, length = 50)
    private String metricName;

    @Column(name = "actual_value", nullable = false)
    private double actualValue;

    @Column(name = "expected_value")
    private double expectedValue;

    @Column(name = "deviation_pct")
    private double deviationPct;

    @Column(name = "z_score")
    private double zScore;

    @Convert(converter = AnomalyTypeConverter.class)
    @Column(name = "anomaly_type", length = 20)
    private AnomalyType anomalyType;

    @Convert(converter = SeverityConverter.class)
    @Column(name = "severity", length = 20)
    private Severity severity;

    @Column(name = "is_weekend")
    private boolean weekend;

    @Column(name = "day_of_week")
    private int dayOfWeek;

    @Column(name = "business_interpretation", columnDefinition = "TEXT")
    private String businessInterpretation;

    @Column(name = "recommended_action", columnDefinition = "TEXT")
    private String recommendedAction;

    /** Null on an incoming write means "leave the stored acknowledgment untouched". */
    @Column(name = "acknowledged")
    private Boolean acknowledged;

    @Column(name = "acknowledged_by", length = 100)
    private String acknowledgedBy;

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;

    @Column(name = "model_run_id")
    private Long modelRunId;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isAcknowledged() {
        return Boolean.TRUE.equals(acknowledged);
    }

    public void overwriteValues(AnomalyRecord source) {
        this.actualValue = source.actualValue;
        this.expectedValue = source.expectedValue;
        this.deviationPct = source.deviationPct;
        this.zScore = source.zScore;
        this.anomalyType = source.anomalyType;
        this.severity = source.severity;
        this.weekend = source.weekend;
        this.dayOfWeek = source.dayOfWeek;
        this.businessInterpretation = source.businessInterpretation;
        this.recommendedAction = source.recommendedAction;
        this.modelRunId = source.modelRunId;
        if (source.acknowledged != null) {
            this.acknowledged = source.acknowledged;
            this.acknowledgedBy = source.acknowledgedBy;
            this.acknowledgedAt = source.acknowledgedAt;
        }
    }
}
