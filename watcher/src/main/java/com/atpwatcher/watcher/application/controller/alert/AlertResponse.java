package com.atpwatcher.watcher.application.controller.alert;

import com.atpwatcher.common.event.AlertCategory;
import com.atpwatcher.common.event.Severity;
import com.atpwatcher.common.event.TriggerType;
import java.math.BigDecimal;
import java.time.Instant;

public record AlertResponse(
        String id,
        AlertCategory category,
        TriggerType triggerType,
        Severity severity,
        String targetId,
        String displayName,
        String message,
        BigDecimal previousValue,
        BigDecimal currentValue,
        BigDecimal deltaPct,
        BigDecimal threshold,
        Instant timestamp,
        boolean delivered) {}
