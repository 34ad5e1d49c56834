package com.atpwatcher.watcher.infrastructure.http;

import com.atpwatcher.watcher.application.config.WatcherProperties;
import com.atpwatcher.watcher.domain.exceptions.SignalFetchException;
import com.atpwatcher.watcher.domain.signal.SignalSource;
import java.math.BigDecimal;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Reads holdings and prices from the IQ agents API.
 *
 * <p>Network errors, 429 and 503 are retried with exponential backoff; anything
 * left after the retry budget surfaces as {@link SignalFetchException}.
 */
@Slf4j
@Component
public class IqApiSignalSource implements SignalSource {

    private final RestClient restClient;
    private final WatcherProperties.Retry retry;

    public IqApiSignalSource(RestClient iqApiRestClient, WatcherProperties properties) {
        this.restClient = iqApiRestClient;
        this.retry = properties.api().retry();
    }

    @Override
    public BigDecimal fetchPortfolioValue(String walletId) {
        var response = withRetry("holdings of " + walletId, () -> restClient.get()
                .uri("/holdings?address={address}", walletId)
                .retrieve()
                .body(HoldingsResponse.class));
        if (response == null || response.holdings() == null) {
            throw SignalFetchException.of("Empty holdings response for " + walletId);
        }
        var total = BigDecimal.ZERO;
        for (var holding : response.holdings()) {
            if (holding.tokenAmount() == null || holding.currentPriceInUsd() == null) {
                log.debug("Skipping holding {} without amount or price", holding.tokenContract());
                continue;
            }
            total = total.add(holding.tokenAmount().multiply(holding.currentPriceInUsd()));
        }
        log.debug("Portfolio {} valued at {} across {} holdings", walletId, total, response.holdings().size());
        return total;
    }

    @Override
    public BigDecimal fetchTokenPrice(String tokenId) {
        var stats = withRetry("stats of " + tokenId, () -> restClient.get()
                .uri("/agents/stats?address={address}", tokenId)
                .retrieve()
                .body(AgentStatsResponse.class));
        if (stats == null || stats.currentPriceInUsd() == null) {
            throw SignalFetchException.of("No USD price for " + tokenId);
        }
        return stats.currentPriceInUsd();
    }

    @Override
    public BigDecimal fetchBaseTokenPrice() {
        var prices = withRetry("base token price", () -> restClient.get()
                .uri("/prices")
                .retrieve()
                .body(PricesResponse.class));
        if (prices == null || prices.everipedia() == null || prices.everipedia().usd() == null) {
            throw SignalFetchException.of("No base token price in response");
        }
        return prices.everipedia().usd();
    }

    private <T> T withRetry(String description, Supplier<T> call) {
        var delay = retry.initialDelayMs();
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (RestClientException e) {
                if (!isRetryable(e) || attempt > retry.maxRetries()) {
                    throw SignalFetchException.of("Fetching " + description + " failed: " + e.getMessage(), e);
                }
                log.warn("Fetching {} failed: {}. Retrying in {}ms ({}/{})",
                        description, e.getMessage(), delay, attempt, retry.maxRetries());
            }
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw SignalFetchException.of("Interrupted while fetching " + description, e);
            }
            delay = Math.min(delay * retry.multiplier(), retry.maxDelayMs());
        }
    }

    private static boolean isRetryable(RestClientException e) {
        if (e instanceof ResourceAccessException) {
            return true;
        }
        if (e instanceof RestClientResponseException response) {
            var status = response.getStatusCode().value();
            return status == HttpStatus.TOO_MANY_REQUESTS.value() || status == HttpStatus.SERVICE_UNAVAILABLE.value();
        }
        return false;
    }
}
