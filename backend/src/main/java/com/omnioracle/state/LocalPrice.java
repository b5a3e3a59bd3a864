package com.omnioracle.state;

import java.math.BigInteger;

/**
 * The instance's latest accepted price. {@code nativePrice} is zero until a native price is known.
 */
public record LocalPrice(BigInteger price, BigInteger nativePrice, long timestamp) {

    public static final LocalPrice EMPTY = new LocalPrice(BigInteger.ZERO, BigInteger.ZERO, 0L);

    public boolean isInitialized() {
        return timestamp > 0 && price.signum() > 0;
    }
}
