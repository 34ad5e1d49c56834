package com.atpwatcher.watcher.application.controller.watch;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

public record UpdateWatchRequest(
        @Size(max = 128) String displayName,
        @DecimalMin(value = "0", inclusive = false) BigDecimal minorThreshold,
        @DecimalMin(value = "0", inclusive = false) BigDecimal majorThreshold,
        @DecimalMin(value = "0", inclusive = false) BigDecimal criticalThreshold,
        Boolean minorEnabled,
        Boolean majorEnabled,
        Boolean criticalEnabled,
        @Min(30) @Max(3600) Integer sampleIntervalSeconds,
        @DecimalMin(value = "0", inclusive = false) BigDecimal milestoneUsd) {}
