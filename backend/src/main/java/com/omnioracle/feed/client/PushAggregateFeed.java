package com.omnioracle.feed.client;

/**
 * Externally pushed reference feed with a structured call and a legacy reference-rate call.
 */
public interface PushAggregateFeed {

    PushPrice priceFor(String symbol);

    ReferenceRate referenceRate(String base, String quote);
}
