package com.kpiforecast.repository;

import com.kpiforecast.entity.BacktestPoint;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BacktestPointRepository extends JpaRepository<BacktestPoint, Long> {

    List<BacktestPoint> findByRunIdOrderByPredictionDateAsc(Long runId);
}
