package com.atpwatcher.watcher.infrastructure.db.target;

import com.atpwatcher.watcher.domain.target.WatchKind;
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
@Table(name = "watch_targets")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WatchTargetEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "display_name", nullable = false, length = 128)
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private WatchKind kind;

    @Column(name = "minor_threshold", nullable = false, precision = 12, scale = 4)
    private BigDecimal minorThreshold;

    @Column(name = "major_threshold", nullable = false, precision = 12, scale = 4)
    private BigDecimal majorThreshold;

    @Column(name = "critical_threshold", nullable = false, precision = 12, scale = 4)
    private BigDecimal criticalThreshold;

    @Column(name = "minor_enabled", nullable = false)
    private boolean minorEnabled;

    @Column(name = "major_enabled", nullable = false)
    private boolean majorEnabled;

    @Column(name = "critical_enabled", nullable = false)
    private boolean criticalEnabled;

    @Column(name = "sample_interval_seconds", nullable = false)
    private int sampleIntervalSeconds;

    @Column(name = "milestone_usd", precision = 30, scale = 12)
    private BigDecimal milestoneUsd;

    @Column(name = "last_observed_value", nullable = false, precision = 30, scale = 12)
    private BigDecimal lastObservedValue;

    @Column(name = "last_sample_time")
    private Instant lastSampleTime;

    @Column(name = "threshold_latched", nullable = false)
    private boolean thresholdLatched;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
