package com.kpiforecast.service;

import com.kpiforecast.entity.DailyKpi;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

/** Daily KPI rows for service tests. Revenue follows {@code revenue}, the other columns are flat. */
final class KpiRows {

    static final LocalDate START = LocalDate.of(2024, 1, 1);

    private KpiRows() {
    }

    static List<DailyKpi> daily(int days, IntToDoubleFunction revenue) {
        List<DailyKpi> rows = new ArrayList<>(days);
        for (int i = 0; i < days; i++) {
            rows.add(DailyKpi.builder()
                .fullDate(START.plusDays(i))
                .totalRevenue(revenue.applyAsDouble(i))
                .totalOrders(50.0)
                .uniqueCustomers(40.0)
                .avgOrderValue(25.0)
                .totalItemsSold(120.0)
                .build());
        }
        return rows;
    }

    /** Upward trend with a weekly cycle, always positive. */
    static List<DailyKpi> weekly(int days) {
        double[] week = {0, 40, 60, 50, 80, 150, 120};
        return daily(days, i -> 1000 + 2.0 * i + week[i % 7]);
    }
}
