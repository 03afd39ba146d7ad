package com.kpiforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BacktestResponse {
    String metric;
    String model;
    int holdoutDays;
    double mape;
    double smape;
    double rmse;
    double mae;
    double baselineMape;
    double baselineRmse;
    Double improvementPct;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate trainStart;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate trainEnd;
    int trainSamples;
    int testSamples;
    Map<String, Object> params;
    List<HoldoutDay> holdout;
    /** MAPE of every candidate that survived selection; only set for automatic selection. */
    Map<String, Double> candidateMape;
    /** Failure reason of every excluded candidate; only set for automatic selection. */
    Map<String, String> excludedCandidates;

    @Value
    @Builder
    public static class HoldoutDay {
        @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate date;
        double actual;
        double predicted;
        double lowerBound;
        double upperBound;
    }
}
