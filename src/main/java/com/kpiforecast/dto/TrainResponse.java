package com.kpiforecast.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class TrainResponse {
    String status;
    List<String> metricsTrained;
    int forecastsGenerated;
    int anomaliesDetected;
    /** Forecast run id per metric. */
    Map<String, Long> forecastRunIds;
    /** Anomaly run id per metric. */
    Map<String, Long> anomalyRunIds;
    /** Winning model per metric. */
    Map<String, String> models;
}
