package com.omnioracle.feed.client;

import java.math.BigInteger;

/**
 * Structured push-aggregate answer: price with 9 fractional digits.
 */
public record PushPrice(BigInteger price1e9, long timestamp) {}
