package com.resourcelocator.infrastructure.token;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;

/**
 * Nonces of tokens already redeemed.
 *
 * <p>An entry only needs to outlive the token it belongs to, so entries expire after
 * the maximum token lifetime. A token is rejected as expired before the ledger is
 * consulted once that lifetime has passed.
 */
public class ReplayLedger {

    private final Cache<String, Boolean> redeemed;

    public ReplayLedger(Duration retention) {
        this(retention, Ticker.systemTicker());
    }

    public ReplayLedger(Duration retention, Ticker ticker) {
        this.redeemed = Caffeine.newBuilder()
            .expireAfterWrite(retention)
            .ticker(ticker)
            .build();
    }

    /**
     * Record a redemption.
     *
     * @param nonce Token nonce
     * @return {@code true} the first time a nonce is seen, {@code false} on replay
     */
    public boolean markRedeemed(String nonce) {
        return redeemed.asMap().putIfAbsent(nonce, Boolean.TRUE) == null;
    }
}
