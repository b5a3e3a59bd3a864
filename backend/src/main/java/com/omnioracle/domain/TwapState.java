package com.omnioracle.domain;

import java.math.BigInteger;

/**
 * Cumulative-price snapshot of one pool, advanced once per completed TWAP window.
 */
public record TwapState(
        BigInteger cumulativePrice0Last,
        BigInteger cumulativePrice1Last,
        long lastTimestamp,
        BigInteger ratio18
) {}
