package com.omnioracle.feed;

import com.omnioracle.common.FixedPoint;
import com.omnioracle.domain.FeedKind;
import com.omnioracle.domain.FeedSource;
import com.omnioracle.domain.QuoteResult;
import com.omnioracle.feed.client.FeedClientFactory;
import com.omnioracle.feed.client.PullQuoteFeed;
import com.omnioracle.feed.client.RoundData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Round-based latest-value feeds. Answers are rescaled from the feed's reported decimals.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PullQuoteAdapter implements FeedAdapter {

    static final int ASSUMED_DECIMALS = 8;

    private final FeedClientFactory clients;

    @Override
    public FeedKind kind() {
        return FeedKind.PULL_QUOTE;
    }

    @Override
    public QuoteResult quote(FeedSource source, long nowSeconds) {
        PullQuoteFeed feed = clients.pullQuote(source.endpointRef());
        RoundData round;
        try {
            round = feed.latestValue();
        } catch (RuntimeException e) {
            log.debug("Pull-quote source {} unavailable: {}", source.id(), e.getMessage());
            return QuoteResult.unavailable();
        }
        if (round == null || round.answer() == null || round.answer().signum() <= 0) {
            log.debug("Pull-quote source {} returned non-positive answer", source.id());
            return QuoteResult.unavailable();
        }
        if (nowSeconds - round.updatedAt() > source.maxStalenessSeconds()) {
            log.debug("Pull-quote source {} stale: updatedAt={} now={}", source.id(), round.updatedAt(), nowSeconds);
            return QuoteResult.stale();
        }
        return QuoteResult.ok(FixedPoint.rescale(round.answer(), decimalsOf(feed, source)));
    }

    private int decimalsOf(PullQuoteFeed feed, FeedSource source) {
        try {
            return feed.decimalCount();
        } catch (RuntimeException e) {
            log.debug("decimals() failed for source {}, assuming {}", source.id(), ASSUMED_DECIMALS);
            return ASSUMED_DECIMALS;
        }
    }
}
