package com.atpwatcher.watcher.domain.classification;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Maps a pair of consecutive samples to the highest tier whose threshold the
 * absolute percentage move meets. Tiers are tested critical, then major, then minor.
 */
public class ThresholdClassifier {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public Classification classify(BigDecimal previous, BigDecimal current, TierConfig tiers) {
        if (previous == null || previous.signum() <= 0) {
            // baseline sample, nothing to compare against
            return Classification.none(BigDecimal.ZERO, BigDecimal.ZERO);
        }
        var delta = current.subtract(previous);
        if (delta.signum() == 0) {
            return Classification.none(BigDecimal.ZERO, delta);
        }
        var deltaPct = delta.multiply(HUNDRED).divide(previous, MathContext.DECIMAL64);
        return new Classification(tierFor(deltaPct.abs(), tiers), deltaPct, delta);
    }

    private Tier tierFor(BigDecimal magnitude, TierConfig tiers) {
        if (magnitude.compareTo(tiers.critical()) >= 0) {
            return Tier.CRITICAL;
        }
        if (magnitude.compareTo(tiers.major()) >= 0) {
            return Tier.MAJOR;
        }
        if (magnitude.compareTo(tiers.minor()) >= 0) {
            return Tier.MINOR;
        }
        return Tier.NONE;
    }
}
