package com.kpiforecast.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class AnomalyRequest {

    @NotBlank(message = "metric is required")
    @Builder.Default
    String metric = "total_revenue";

    @Min(value = 1, message = "lookbackDays must be between 1 and 3650")
    @Max(value = 3650, message = "lookbackDays must be between 1 and 3650")
    @Builder.Default
    int lookbackDays = 30;

    @DecimalMin(value = "0.0", inclusive = false, message = "contamination must be in (0, 0.5]")
    @DecimalMax(value = "0.5", message = "contamination must be in (0, 0.5]")
    @Builder.Default
    double contamination = 0.1;
}
