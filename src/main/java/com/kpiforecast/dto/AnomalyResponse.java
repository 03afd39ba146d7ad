package com.kpiforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class AnomalyResponse {
    String metric;
    List<AnomalyRecordResponse> anomalies;
    int totalChecked;
    int anomaliesFound;
    Long runId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
}
