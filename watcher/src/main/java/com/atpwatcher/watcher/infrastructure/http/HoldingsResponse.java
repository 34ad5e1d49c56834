package com.atpwatcher.watcher.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HoldingsResponse(Integer count, List<Holding> holdings) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Holding(String tokenContract, BigDecimal tokenAmount, String name, BigDecimal currentPriceInUsd) {}
}
