package com.kpiforecast.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.time.LocalDate;

/** One training attempt. Rows are written once and never updated. */
@Entity
@Immutable
@Table(
    name = "ml_model_runs",
    indexes = {
        @Index(name = "idx_run_metric",    columnList = "target_metric"),
        @Index(name = "idx_run_timestamp", columnList = "run_timestamp"),
    }
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "run_id", updatable = false, nullable = false)
    private Long runId;

    @CreationTimestamp
    @Column(name = "run_timestamp", updatable = false)
    private Instant runTimestamp;

    @Column(name = "model_type", nullable = false, length = 50)
    private String modelType;

    @Column(name = "target_metric", nullable = false, length = 50)
    private String targetMetric;

    @Column(name = "train_start_date", nullable = false)
    private LocalDate trainStartDate;

    @Column(name = "train_end_date", nullable = false)
    private LocalDate trainEndDate;

    @Column(name = "train_samples", nullable = false)
    private int trainSamples;

    /** Hyperparameters as a JSON object. */
    @Column(name = "parameters", nullable = false, columnDefinition = "TEXT")
    private String parameters;

    private Double mape;
    private Double smape;
    private Double rmse;
    private Double mae;

    @Column(name = "baseline_mape")
    private Double baselineMape;

    @Column(name = "baseline_rmse")
    private Double baselineRmse;

    @Column(name = "improvement_vs_baseline_pct")
    private Double improvementPct;

    @Column(name = "model_version", length = 50)
    private String modelVersion;

    @Column(name = "code_version", length = 50)
    private String codeVersion;

    @Column(length = 20)
    private String status;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(columnDefinition = "TEXT")
    private String notes;
}
