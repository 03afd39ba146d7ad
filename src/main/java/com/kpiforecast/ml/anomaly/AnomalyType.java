package com.kpiforecast.ml.anomaly;

public enum AnomalyType {
    SPIKE("spike"),
    DROP("drop");

    private final String label;

    AnomalyType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static AnomalyType fromLabel(String label) {
        for (AnomalyType type : values()) {
            if (type.label.equalsIgnoreCase(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown anomaly type: " + label);
    }
}
