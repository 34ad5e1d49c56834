package com.atpwatcher.watcher.domain.store;

import java.math.BigDecimal;
import java.time.Instant;

public record PriceHistoryPoint(String targetId, String label, BigDecimal value, Instant timestamp) {
}
