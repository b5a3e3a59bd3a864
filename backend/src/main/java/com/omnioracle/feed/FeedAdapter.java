package com.omnioracle.feed;

import com.omnioracle.domain.FeedKind;
import com.omnioracle.domain.FeedSource;
import com.omnioracle.domain.QuoteResult;

/**
 * Normalizes one feed kind into an 18-decimal quote. Implementations must not throw: transport or format
 * failures map to {@link QuoteResult#unavailable()}, age violations to {@link QuoteResult#stale()}.
 */
public interface FeedAdapter {

    FeedKind kind();

    QuoteResult quote(FeedSource source, long nowSeconds);
}
