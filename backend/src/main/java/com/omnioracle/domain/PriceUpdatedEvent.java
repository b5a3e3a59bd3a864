package com.omnioracle.domain;

import java.math.BigInteger;

/**
 * Application event: a locally aggregated price was accepted as the latest price.
 */
public record PriceUpdatedEvent(BigInteger price, BigInteger nativePrice, long timestamp, boolean degraded) {}
