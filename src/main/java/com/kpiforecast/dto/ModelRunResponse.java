package com.kpiforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelRunResponse {
    long runId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant runTimestamp;
    String modelType;
    String targetMetric;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate trainStart;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate trainEnd;
    int trainSamples;
    Double mape;
    Double smape;
    Double rmse;
    Double mae;
    Double baselineMape;
    Double baselineRmse;
    Double improvementPct;
    String modelVersion;
    String codeVersion;
    String status;
    String createdBy;
}
