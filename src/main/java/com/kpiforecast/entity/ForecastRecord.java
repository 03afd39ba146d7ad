package com.kpiforecast.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@IdClass(ForecastKey.class)
@Table(
    name = "ml_forecast_daily",
    indexes = {
        @Index(name = "idx_forecast_metric", columnList = "metric_name"),
        @Index(name = "idx_forecast_run",    columnList = "model_run_id"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ForecastRecord {

    @Id
    @Column(name = "forecast_date", nullable = false)
    private LocalDate forecastDate;

    @Id
    @Column(name = "metric_name", nullable = false, length = 50)
    private String metricName;

    @Column(name = "predicted_value", nullable = false)
    private double predictedValue;

    @Column(name = "lower_bound")
    private double lowerBound;

    @Column(name = "upper_bound")
    private double upperBound;

    @Column(name = "confidence_level")
    private double confidenceLevel;

    @Column(name = "model_run_id")
    private Long modelRunId;

    @Column(name = "model_name", length = 100)
    private String modelName;

    @Column(name = "model_version", length = 20)
    private String modelVersion;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /** Copies every value field of {@code source}; the key and creation time are left alone. */
    public void overwriteValues(ForecastRecord source) {
        this.predictedValue = source.predictedValue;
        this.lowerBound = source.lowerBound;
        this.upperBound = source.upperBound;
        this.confidenceLevel = source.confidenceLevel;
        this.modelRunId = source.modelRunId;
        this.modelName = source.modelName;
        this.modelVersion = source.modelVersion;
    }
}
