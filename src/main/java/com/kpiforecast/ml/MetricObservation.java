package com.kpiforecast.ml;

import java.time.LocalDate;

public record MetricObservation(LocalDate date, String metric, double value) {}
