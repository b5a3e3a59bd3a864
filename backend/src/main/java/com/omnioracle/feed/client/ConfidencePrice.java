package com.omnioracle.feed.client;

import java.math.BigInteger;

/**
 * Confidence-interval answer: {@code price * 10^exponent} USD, ± {@code confidence} at the same exponent.
 */
public record ConfidencePrice(BigInteger price, BigInteger confidence, int exponent, long publishTime) {}
