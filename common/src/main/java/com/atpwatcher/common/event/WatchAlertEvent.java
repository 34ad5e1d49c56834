package com.atpwatcher.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;

@Builder(toBuilder = true)
public record WatchAlertEvent(
        @JsonProperty("alert_id") String alertId,
        AlertCategory category,
        @JsonProperty("trigger_type") TriggerType triggerType,
        Severity severity,
        @JsonProperty("target_id") String targetId,
        @JsonProperty("display_name") String displayName,
        @JsonProperty("previous_value") BigDecimal previousValue,
        @JsonProperty("current_value") BigDecimal currentValue,
        @JsonProperty("delta_pct") BigDecimal deltaPct,
        BigDecimal threshold,
        String message,
        @JsonProperty("triggered_at") Instant triggeredAt) {}
