package com.kpiforecast.ml.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum ModelType {
    SEASONAL_TREND("seasonal_trend", "SeasonalTrend"),
    HOLT_WINTERS("holt_winters", "HoltWinters");

    private final String id;
    private final String displayName;

    ModelType(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    /** Model type as written to the run ledger. */
    public String ledgerType() {
        return "forecast_" + id;
    }

    public static Optional<ModelType> fromId(String id) {
        return Arrays.stream(values()).filter(t -> t.id.equalsIgnoreCase(id)).findFirst();
    }

    public static List<String> ids() {
        return Arrays.stream(values()).map(ModelType::id).toList();
    }
}
