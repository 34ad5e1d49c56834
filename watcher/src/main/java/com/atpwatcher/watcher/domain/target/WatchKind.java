package com.atpwatcher.watcher.domain.target;

import com.atpwatcher.common.event.AlertCategory;
import com.atpwatcher.watcher.domain.signal.SignalSource;
import com.atpwatcher.watcher.domain.suppression.SuppressionMode;
import java.math.BigDecimal;
import java.util.List;

/**
 * What a target watches. The kind picks the signal to read and the suppression
 * modes applied to each sample.
 */
public enum WatchKind {
    PORTFOLIO(AlertCategory.HOLDINGS, List.of(SuppressionMode.EDGE_TRIGGERED, SuppressionMode.LEVEL_TRIGGERED)),
    TOKEN(AlertCategory.PRICE, List.of(SuppressionMode.EDGE_TRIGGERED)),
    BASE_TOKEN(AlertCategory.BASE_TOKEN_PRICE, List.of(SuppressionMode.EDGE_TRIGGERED));

    private final AlertCategory category;
    private final List<SuppressionMode> suppressionModes;

    WatchKind(AlertCategory category, List<SuppressionMode> suppressionModes) {
        this.category = category;
        this.suppressionModes = suppressionModes;
    }

    public AlertCategory category() {
        return category;
    }

    public List<SuppressionMode> suppressionModes() {
        return suppressionModes;
    }

    public boolean tracksMilestone() {
        return suppressionModes.contains(SuppressionMode.LEVEL_TRIGGERED);
    }

    public BigDecimal sample(SignalSource source, String targetId) {
        return switch (this) {
            case PORTFOLIO -> source.fetchPortfolioValue(targetId);
            case TOKEN -> source.fetchTokenPrice(targetId);
            case BASE_TOKEN -> source.fetchBaseTokenPrice();
        };
    }
}
