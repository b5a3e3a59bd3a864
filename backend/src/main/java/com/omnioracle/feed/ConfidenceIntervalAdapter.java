package com.omnioracle.feed;

import com.omnioracle.common.FixedPoint;
import com.omnioracle.domain.FeedKind;
import com.omnioracle.domain.FeedSource;
import com.omnioracle.domain.QuoteResult;
import com.omnioracle.feed.client.ConfidencePrice;
import com.omnioracle.feed.client.FeedClientFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Price-plus-exponent feeds, keyed by the feed id in {@link FeedSource#extra()}. Confidence is not used.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfidenceIntervalAdapter implements FeedAdapter {

    private final FeedClientFactory clients;

    @Override
    public FeedKind kind() {
        return FeedKind.CONFIDENCE_INTERVAL;
    }

    @Override
    public QuoteResult quote(FeedSource source, long nowSeconds) {
        ConfidencePrice price;
        try {
            price = clients.confidenceInterval(source.endpointRef()).priceUnsafe(source.extra());
        } catch (RuntimeException e) {
            log.debug("Confidence-interval source {} unavailable: {}", source.id(), e.getMessage());
            return QuoteResult.unavailable();
        }
        if (price == null || price.price() == null || price.price().signum() <= 0) {
            return QuoteResult.unavailable();
        }
        if (nowSeconds - price.publishTime() > source.maxStalenessSeconds()) {
            log.debug("Confidence-interval source {} stale: publishTime={}", source.id(), price.publishTime());
            return QuoteResult.stale();
        }
        try {
            return QuoteResult.ok(FixedPoint.applyExponent(price.price(), price.exponent()));
        } catch (ArithmeticException e) {
            return QuoteResult.unavailable();
        }
    }
}
