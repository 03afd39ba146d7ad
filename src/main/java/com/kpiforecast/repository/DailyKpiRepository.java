package com.kpiforecast.repository;

import com.kpiforecast.entity.DailyKpi;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface DailyKpiRepository extends JpaRepository<DailyKpi, LocalDate> {

    List<DailyKpi> findAllByOrderByFullDateAsc();

    @Query("SELECT MAX(k.fullDate) FROM DailyKpi k")
    Optional<LocalDate> findLatestDate();
}
