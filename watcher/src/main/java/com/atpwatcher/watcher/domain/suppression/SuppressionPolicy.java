package com.atpwatcher.watcher.domain.suppression;

import com.atpwatcher.watcher.domain.classification.Classification;
import com.atpwatcher.watcher.domain.target.WatchTarget;
import java.math.BigDecimal;

/**
 * Decides whether a classified sample becomes an alert.
 *
 * <p>Edge-triggered mode keeps no memory beyond the previous sample, so a steady
 * drift alerts on every qualifying tick. Level-triggered mode latches on the
 * milestone and only fires on the false to true transition.
 */
public class SuppressionPolicy {

    public SuppressionDecision decide(
            SuppressionMode mode, WatchTarget target, Classification classification, BigDecimal current) {
        return switch (mode) {
            case EDGE_TRIGGERED -> edge(target, classification);
            case LEVEL_TRIGGERED -> level(target, current);
        };
    }

    private SuppressionDecision edge(WatchTarget target, Classification classification) {
        var emit = classification.hasTier() && target.alertToggles().isEnabled(classification.tier());
        return new SuppressionDecision(SuppressionMode.EDGE_TRIGGERED, emit, target.thresholdLatched());
    }

    private SuppressionDecision level(WatchTarget target, BigDecimal current) {
        var milestone = target.milestoneUsd();
        var latched = target.thresholdLatched();
        if (milestone == null) {
            return new SuppressionDecision(SuppressionMode.LEVEL_TRIGGERED, false, latched);
        }
        var atOrAbove = current.compareTo(milestone) >= 0;
        if (atOrAbove && !latched) {
            return new SuppressionDecision(SuppressionMode.LEVEL_TRIGGERED, true, true);
        }
        if (!atOrAbove && latched) {
            return new SuppressionDecision(SuppressionMode.LEVEL_TRIGGERED, false, false);
        }
        return new SuppressionDecision(SuppressionMode.LEVEL_TRIGGERED, false, latched);
    }
}
