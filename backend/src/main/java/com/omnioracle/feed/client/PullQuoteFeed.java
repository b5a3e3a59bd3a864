package com.omnioracle.feed.client;

/**
 * Round-based latest-value feed. Implementations throw on transport or format failure.
 */
public interface PullQuoteFeed {

    RoundData latestValue();

    int decimalCount();
}
