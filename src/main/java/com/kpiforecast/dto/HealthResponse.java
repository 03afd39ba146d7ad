package com.kpiforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthResponse {
    String status;
    boolean databaseConnected;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate lastDataDate;
    long totalRecords;
    String version;
}
