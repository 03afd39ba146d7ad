package com.kpiforecast.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ForecastRequest {

    @NotBlank(message = "metric is required")
    @Builder.Default
    String metric = "total_revenue";

    @Min(value = 1, message = "forecastDays must be between 1 and 365")
    @Max(value = 365, message = "forecastDays must be between 1 and 365")
    @Builder.Default
    int forecastDays = 7;

    /** auto, seasonal_trend or holt_winters. */
    @NotBlank(message = "model is required")
    @Builder.Default
    String model = "auto";
}
