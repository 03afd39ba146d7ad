package com.kpiforecast.repository;

import com.kpiforecast.entity.DailyKpi;

import java.util.List;

/** Source of the daily KPI history. */
public interface MetricSeriesReader {

    /** Every known day, oldest first. Empty when the mart has not been loaded. */
    List<DailyKpi> readAll();
}
