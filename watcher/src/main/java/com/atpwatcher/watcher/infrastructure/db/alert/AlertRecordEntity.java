package com.atpwatcher.watcher.infrastructure.db.alert;

import com.atpwatcher.common.event.AlertCategory;
import com.atpwatcher.common.event.Severity;
import com.atpwatcher.common.event.TriggerType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "alert_records")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertRecordEntity {

    @Id
    @Column(length = 26)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AlertCategory category;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, length = 20)
    private TriggerType triggerType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Severity severity;

    @Column(name = "target_id", length = 64)
    private String targetId;

    @Column(name = "display_name", length = 128)
    private String displayName;

    @Column(nullable = false, length = 2000)
    private String message;

    @Column(name = "previous_value", precision = 30, scale = 12)
    private BigDecimal previousValue;

    @Column(name = "current_value", precision = 30, scale = 12)
    private BigDecimal currentValue;

    @Column(name = "delta_pct", precision = 20, scale = 8)
    private BigDecimal deltaPct;

    @Column(name = "threshold_value", precision = 30, scale = 12)
    private BigDecimal threshold;

    @Column(name = "triggered_at", nullable = false, updatable = false)
    private Instant triggeredAt;

    @Column(nullable = false)
    private boolean delivered;
}
