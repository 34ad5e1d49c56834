package com.atpwatcher.watcher.application.controller.defaults;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record DefaultsRequest(
        @NotNull @DecimalMin(value = "0", inclusive = false) BigDecimal minorThreshold,
        @NotNull BigDecimal majorThreshold,
        @NotNull BigDecimal criticalThreshold,
        @NotNull @Min(30) @Max(3600) Integer sampleIntervalSeconds) {}
