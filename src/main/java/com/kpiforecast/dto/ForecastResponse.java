package com.kpiforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ForecastResponse {
    String metric;
    String modelName;
    String modelVersion;
    Long runId;
    int horizonDays;
    List<ForecastPointResponse> forecasts;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
}
