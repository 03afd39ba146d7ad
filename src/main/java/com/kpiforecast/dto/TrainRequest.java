package com.kpiforecast.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/** An empty or missing metric list trains the configured default metrics. */
@Value
@Builder
@Jacksonized
public class TrainRequest {
    List<String> metrics;
}
