package com.atpwatcher.watcher.domain.suppression;

public record SuppressionDecision(SuppressionMode mode, boolean emit, boolean latched) {
}
