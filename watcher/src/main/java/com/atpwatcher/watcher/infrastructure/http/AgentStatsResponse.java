package com.atpwatcher.watcher.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentStatsResponse(
        @JsonProperty("currentPriceInUSD") BigDecimal currentPriceInUsd,
        BigDecimal currentPriceInIq,
        BigDecimal changeIn24h) {}
