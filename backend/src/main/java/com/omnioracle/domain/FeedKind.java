package com.omnioracle.domain;

/**
 * Wire format family of an external price feed.
 */
public enum FeedKind {
    /** Round-based latest-value feed with reported decimals. */
    PULL_QUOTE,
    /** Externally pushed reference feed (structured 1e9 price, legacy 1e18 rate). */
    PUSH_AGGREGATE,
    /** Single read call already at 18 decimals. */
    PROXY_READ,
    /** Price with base-10 exponent and confidence band. */
    CONFIDENCE_INTERVAL
}
