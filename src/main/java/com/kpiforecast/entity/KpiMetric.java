package com.kpiforecast.entity;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/** The daily KPI columns that can be forecast and scanned for anomalies. */
public enum KpiMetric {
    TOTAL_REVENUE("total_revenue", DailyKpi::getTotalRevenue),
    TOTAL_ORDERS("total_orders", DailyKpi::getTotalOrders),
    UNIQUE_CUSTOMERS("unique_customers", DailyKpi::getUniqueCustomers),
    AVG_ORDER_VALUE("avg_order_value", DailyKpi::getAvgOrderValue),
    TOTAL_ITEMS_SOLD("total_items_sold", DailyKpi::getTotalItemsSold);

    private final String columnName;
    private final Function<DailyKpi, Double> extractor;

    KpiMetric(String columnName, Function<DailyKpi, Double> extractor) {
        this.columnName = columnName;
        this.extractor = extractor;
    }

    public String columnName() {
        return columnName;
    }

    /** Null when the row has no value for this metric. */
    public Double valueOf(DailyKpi row) {
        return extractor.apply(row);
    }

    public static Optional<KpiMetric> fromColumnName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(m -> m.columnName.equals(name.trim().toLowerCase(Locale.ROOT)))
            .findFirst();
    }

    public static List<String> columnNames() {
        return Arrays.stream(values()).map(KpiMetric::columnName).toList();
    }
}
