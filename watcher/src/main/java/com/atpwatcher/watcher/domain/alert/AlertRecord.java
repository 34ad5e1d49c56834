package com.atpwatcher.watcher.domain.alert;

import com.atpwatcher.common.event.AlertCategory;
import com.atpwatcher.common.event.Severity;
import com.atpwatcher.common.event.TriggerType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;

/**
 * An emitted alert. Append-only; {@code delivered} is the only field ever updated.
 */
@Builder(toBuilder = true)
public record AlertRecord(
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
        boolean delivered
) {
}
