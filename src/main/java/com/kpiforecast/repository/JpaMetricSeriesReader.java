package com.kpiforecast.repository;

import com.kpiforecast.entity.DailyKpi;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Component
@RequiredArgsConstructor
public class JpaMetricSeriesReader implements MetricSeriesReader {

    private final DailyKpiRepository repository;

    @Override
    @Transactional(readOnly = true)
    public List<DailyKpi> readAll() {
        return repository.findAllByOrderByFullDateAsc();
    }
}
