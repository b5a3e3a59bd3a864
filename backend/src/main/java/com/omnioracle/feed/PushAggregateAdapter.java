package com.omnioracle.feed;

import com.omnioracle.common.FixedPoint;
import com.omnioracle.domain.FeedKind;
import com.omnioracle.domain.FeedSource;
import com.omnioracle.domain.QuoteResult;
import com.omnioracle.feed.client.FeedClientFactory;
import com.omnioracle.feed.client.PushAggregateFeed;
import com.omnioracle.feed.client.PushPrice;
import com.omnioracle.feed.client.ReferenceRate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Pushed reference feeds. Structured call first (1e9 price); on failure the legacy base/USD reference rate.
 * The base symbol comes from {@link FeedSource#extra()}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PushAggregateAdapter implements FeedAdapter {

    static final String QUOTE_SYMBOL = "USD";
    private static final int STRUCTURED_DECIMALS = 9;

    private final FeedClientFactory clients;

    @Override
    public FeedKind kind() {
        return FeedKind.PUSH_AGGREGATE;
    }

    @Override
    public QuoteResult quote(FeedSource source, long nowSeconds) {
        PushAggregateFeed feed = clients.pushAggregate(source.endpointRef());
        String symbol = source.extra();
        try {
            PushPrice price = feed.priceFor(symbol);
            if (price != null && price.price1e9() != null) {
                return structured(source, price, nowSeconds);
            }
        } catch (RuntimeException e) {
            log.debug("Structured call failed for source {}, trying reference rate: {}", source.id(), e.getMessage());
        }
        try {
            ReferenceRate rate = feed.referenceRate(symbol, QUOTE_SYMBOL);
            if (rate == null || rate.rate18() == null || rate.rate18().signum() <= 0) {
                return QuoteResult.unavailable();
            }
            if (nowSeconds - rate.lastUpdated() > source.maxStalenessSeconds()) {
                log.debug("Push-aggregate source {} stale: lastUpdated={}", source.id(), rate.lastUpdated());
                return QuoteResult.stale();
            }
            return QuoteResult.ok(rate.rate18());
        } catch (RuntimeException e) {
            log.debug("Push-aggregate source {} unavailable: {}", source.id(), e.getMessage());
            return QuoteResult.unavailable();
        }
    }

    private QuoteResult structured(FeedSource source, PushPrice price, long nowSeconds) {
        if (price.price1e9().signum() <= 0) {
            return QuoteResult.unavailable();
        }
        if (nowSeconds - price.timestamp() > source.maxStalenessSeconds()) {
            log.debug("Push-aggregate source {} stale: timestamp={}", source.id(), price.timestamp());
            return QuoteResult.stale();
        }
        return QuoteResult.ok(FixedPoint.rescale(price.price1e9(), STRUCTURED_DECIMALS));
    }
}
