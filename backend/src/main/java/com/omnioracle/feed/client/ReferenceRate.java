package com.omnioracle.feed.client;

import java.math.BigInteger;

/**
 * Legacy push-aggregate answer: base/quote rate with 18 fractional digits and per-leg update times.
 */
public record ReferenceRate(BigInteger rate18, long lastUpdatedBase, long lastUpdatedQuote) {

    public long lastUpdated() {
        return Math.max(lastUpdatedBase, lastUpdatedQuote);
    }
}
