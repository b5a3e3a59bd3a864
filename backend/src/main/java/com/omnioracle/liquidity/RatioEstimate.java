package com.omnioracle.liquidity;

import java.math.BigInteger;

/**
 * Asset units per one native unit at 18 decimals, with the method that produced it.
 */
public record RatioEstimate(BigInteger ratio18, Method method) {

    public enum Method {
        TWAP,
        SPOT,
        BLENDED
    }
}
