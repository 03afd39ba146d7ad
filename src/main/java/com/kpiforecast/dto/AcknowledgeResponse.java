package com.kpiforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class AcknowledgeResponse {
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    String metric;
    String acknowledgedBy;
    int updated;
}
