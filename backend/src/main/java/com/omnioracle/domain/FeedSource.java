package com.omnioracle.domain;

/**
 * One configured external price input. {@code extra} carries the feed id (confidence-interval feeds)
 * or the base symbol (push-aggregate feeds).
 */
public record FeedSource(
        String id,
        FeedKind kind,
        String endpointRef,
        int weight,
        long maxStalenessSeconds,
        boolean active,
        String extra
) {

    public static final int MAX_WEIGHT = 255;

    public FeedSource withWeight(int newWeight) {
        return new FeedSource(id, kind, endpointRef, newWeight, maxStalenessSeconds, active, extra);
    }

    public FeedSource withActive(boolean newActive) {
        return new FeedSource(id, kind, endpointRef, weight, maxStalenessSeconds, newActive, extra);
    }
}
