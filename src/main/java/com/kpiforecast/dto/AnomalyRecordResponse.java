package com.kpiforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnomalyRecordResponse {
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    String metric;
    double actual;
    double expected;
    double deviationPct;
    @JsonProperty("zScore")
    double zScore;
    String anomalyType;
    String severity;
    boolean weekend;
    int dayOfWeek;
    String businessInterpretation;
    String recommendedAction;
    boolean acknowledged;
    String acknowledgedBy;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant acknowledgedAt;
}
