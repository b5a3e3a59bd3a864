package com.omnioracle.domain;

/**
 * Non-fatal per-source failure reasons.
 */
public enum QuoteError {
    SOURCE_UNAVAILABLE,
    SOURCE_STALE
}
