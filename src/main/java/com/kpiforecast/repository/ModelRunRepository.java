package com.kpiforecast.repository;

import com.kpiforecast.entity.ModelRun;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ModelRunRepository extends JpaRepository<ModelRun, Long> {

    List<ModelRun> findAllByOrderByRunIdDesc(Pageable pageable);

    List<ModelRun> findByTargetMetricOrderByRunIdDesc(String targetMetric, Pageable pageable);
}
