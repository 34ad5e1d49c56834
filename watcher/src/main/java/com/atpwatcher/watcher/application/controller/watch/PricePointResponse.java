package com.atpwatcher.watcher.application.controller.watch;

import java.math.BigDecimal;
import java.time.Instant;

public record PricePointResponse(String targetId, String label, BigDecimal value, Instant timestamp) {}
