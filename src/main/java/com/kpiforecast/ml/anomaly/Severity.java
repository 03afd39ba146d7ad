package com.kpiforecast.ml.anomaly;

/**
 * Severity tiers, highest first. Each tier is reached when either the absolute z-score or the
 * absolute deviation percentage exceeds its bound; the two scales are never blended.
 */
public enum Severity {
    CRITICAL("critical", 4.0, 50.0, 1),
    HIGH("high", 3.0, 30.0, 2),
    MEDIUM("medium", 2.0, 15.0, 3),
    LOW("low", 0.0, 0.0, 4);

    private final String label;
    private final double zBound;
    private final double deviationBound;
    private final int priority;

    Severity(String label, double zBound, double deviationBound, int priority) {
        this.label = label;
        this.zBound = zBound;
        this.deviationBound = deviationBound;
        this.priority = priority;
    }

    public String label() {
        return label;
    }

    /** 1 is the most urgent. */
    public int priority() {
        return priority;
    }

    public boolean isUrgent() {
        return this == CRITICAL || this == HIGH;
    }

    public static Severity classify(double zScore, double deviationPct) {
        double z = Math.abs(zScore);
        double dev = Math.abs(deviationPct);
        for (Severity severity : values()) {
            if (severity == LOW || z > severity.zBound || dev > severity.deviationBound) {
                return severity;
            }
        }
        return LOW;
    }

    public static Severity fromLabel(String label) {
        for (Severity severity : values()) {
            if (severity.label.equalsIgnoreCase(label)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + label);
    }
}
