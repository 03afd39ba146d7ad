package com.kpiforecast.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyKey implements Serializable {
    private LocalDate anomalyDate;
    private String metricName;
}
