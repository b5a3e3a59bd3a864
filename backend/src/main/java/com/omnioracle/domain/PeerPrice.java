package com.omnioracle.domain;

import java.math.BigInteger;

/**
 * Cached peer price. {@code nativePrice} is zero when the peer did not report one.
 */
public record PeerPrice(BigInteger price, BigInteger nativePrice, long timestamp, boolean valid) {}
