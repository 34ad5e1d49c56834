package com.atpwatcher.watcher.application.controller.defaults;

import java.math.BigDecimal;

public record DefaultsResponse(
        BigDecimal minorThreshold,
        BigDecimal majorThreshold,
        BigDecimal criticalThreshold,
        int sampleIntervalSeconds) {}
