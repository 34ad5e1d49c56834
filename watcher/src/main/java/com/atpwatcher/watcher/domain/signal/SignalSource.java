package com.atpwatcher.watcher.domain.signal;

import java.math.BigDecimal;

/**
 * Reads the current value of a monitored quantity.
 * Every method may throw {@link com.atpwatcher.watcher.domain.exceptions.SignalFetchException}.
 */
public interface SignalSource {

    /** Aggregate USD value of all holdings of a wallet. */
    BigDecimal fetchPortfolioValue(String walletId);

    BigDecimal fetchTokenPrice(String tokenId);

    BigDecimal fetchBaseTokenPrice();
}
