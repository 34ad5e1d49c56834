package com.atpwatcher.watcher.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PricesResponse(Quote everipedia) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Quote(BigDecimal usd) {}
}
