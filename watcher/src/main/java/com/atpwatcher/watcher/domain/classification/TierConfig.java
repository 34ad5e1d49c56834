package com.atpwatcher.watcher.domain.classification;

import com.atpwatcher.watcher.domain.exceptions.InvalidWatchConfigException;
import java.math.BigDecimal;

/**
 * Percentage thresholds for the three tiers. Strictly increasing, all positive.
 */
public record TierConfig(BigDecimal minor, BigDecimal major, BigDecimal critical) {

    private static final BigDecimal MAJOR_FACTOR = BigDecimal.valueOf(3);
    private static final BigDecimal CRITICAL_FACTOR = BigDecimal.valueOf(5);

    public TierConfig {
        if (minor == null || major == null || critical == null) {
            throw InvalidWatchConfigException.missing("tier thresholds");
        }
        if (minor.signum() <= 0) {
            throw InvalidWatchConfigException.of("Minor threshold must be positive, got " + minor);
        }
        if (minor.compareTo(major) >= 0 || major.compareTo(critical) >= 0) {
            throw InvalidWatchConfigException.of(
                    "Tier thresholds must be strictly increasing: minor=%s, major=%s, critical=%s"
                            .formatted(minor.toPlainString(), major.toPlainString(), critical.toPlainString()));
        }
    }

    /** Derives major and critical as 3x and 5x of a single change threshold. */
    public static TierConfig scaledFrom(BigDecimal minor) {
        if (minor == null) {
            throw InvalidWatchConfigException.missing("change threshold");
        }
        return new TierConfig(minor, minor.multiply(MAJOR_FACTOR), minor.multiply(CRITICAL_FACTOR));
    }

    public BigDecimal thresholdFor(Tier tier) {
        return switch (tier) {
            case MINOR -> minor;
            case MAJOR -> major;
            case CRITICAL -> critical;
            case NONE -> throw new IllegalArgumentException("NONE has no threshold");
        };
    }
}
