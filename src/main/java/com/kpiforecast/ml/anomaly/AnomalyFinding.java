package com.kpiforecast.ml.anomaly;

import java.time.LocalDate;

/**
 * One flagged day. {@code deviationPct} is already rounded to 2 decimals; the other numbers are
 * left unrounded for the persistence boundary.
 */
public record AnomalyFinding(
    LocalDate date,
    String metric,
    double actual,
    double expected,
    double deviationPct,
    double zScore,
    AnomalyType type,
    Severity severity,
    boolean weekend,
    int dayOfWeek,
    String businessInterpretation,
    String recommendedAction
) {}
