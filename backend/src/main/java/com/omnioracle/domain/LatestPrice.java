package com.omnioracle.domain;

import java.math.BigInteger;

/**
 * Caller-facing price. {@link #NONE} ({@code (0, 0)}) means "no data", never a zero price.
 */
public record LatestPrice(BigInteger price, long timestamp) {

    public static final LatestPrice NONE = new LatestPrice(BigInteger.ZERO, 0L);

    public boolean isPresent() {
        return timestamp > 0 && price.signum() > 0;
    }
}
