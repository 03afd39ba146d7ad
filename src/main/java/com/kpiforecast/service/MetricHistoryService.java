package com.kpiforecast.service;

import com.kpiforecast.entity.DailyKpi;
import com.kpiforecast.entity.KpiMetric;
import com.kpiforecast.exception.InvalidMetricException;
import com.kpiforecast.exception.NoDataException;
import com.kpiforecast.ml.MetricObservation;
import com.kpiforecast.repository.MetricSeriesReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class MetricHistoryService {

    private final MetricSeriesReader reader;

    public KpiMetric resolveMetric(String metric) {
        return KpiMetric.fromColumnName(metric)
            .orElseThrow(() -> new InvalidMetricException(metric, KpiMetric.columnNames()));
    }

    /** All KPI rows, oldest first; never empty. */
    public List<DailyKpi> readAll(String operation) {
        List<DailyKpi> rows = reader.readAll();
        if (rows.isEmpty()) {
            throw new NoDataException(operation);
        }
        log.debug("KPI history loaded | operation={} | rows={} | from={} | to={}",
                  operation, rows.size(), rows.get(0).getFullDate(), rows.get(rows.size() - 1).getFullDate());
        return rows;
    }

    /** One observation per row that carries a value for {@code metric}; rows without one are skipped. */
    public static List<MetricObservation> observations(List<DailyKpi> rows, KpiMetric metric) {
        List<MetricObservation> observations = new ArrayList<>(rows.size());
        for (DailyKpi row : rows) {
            Double value = metric.valueOf(row);
            if (value != null && !value.isNaN()) {
                observations.add(new MetricObservation(row.getFullDate(), metric.columnName(), value));
            }
        }
        return observations;
    }
}
