package com.kpiforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class ForecastPointResponse {
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    String metric;
    double predicted;
    double lowerBound;
    double upperBound;
    double confidenceLevel;
    String modelName;
    String modelVersion;
}
