package com.omnioracle.feed.client;

public interface ConfidenceIntervalFeed {

    /**
     * Latest price without the feed's own staleness guard.
     *
     * @param priceId 0x-prefixed 32-byte feed id
     */
    ConfidencePrice priceUnsafe(String priceId);
}
