package com.kpiforecast.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.time.LocalDate;

/** Holdout prediction of a recorded run against the actual value of that day. */
@Entity
@Immutable
@Table(
    name = "ml_backtest_results",
    indexes = @Index(name = "idx_backtest_run", columnList = "run_id")
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestPoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "backtest_id", updatable = false, nullable = false)
    private Long backtestId;

    @Column(name = "run_id", nullable = false)
    private Long runId;

    @Column(name = "prediction_date", nullable = false)
    private LocalDate predictionDate;

    @Column(name = "actual_value", nullable = false)
    private double actualValue;

    @Column(name = "predicted_value", nullable = false)
    private double predictedValue;

    @Column(name = "lower_bound")
    private double lowerBound;

    @Column(name = "upper_bound")
    private double upperBound;

    @Column(name = "absolute_error")
    private double absoluteError;

    /** Null when the actual value is 0. */
    @Column(name = "percentage_error")
    private Double percentageError;

    @Column(name = "within_confidence_interval")
    private boolean withinInterval;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
