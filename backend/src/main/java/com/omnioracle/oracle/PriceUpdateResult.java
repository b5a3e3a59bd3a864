package com.omnioracle.oracle;

import com.omnioracle.liquidity.RatioEstimate;

import java.math.BigInteger;

/**
 * Accepted update. {@code ratioMethod} is null when no liquidity estimator is configured.
 */
public record PriceUpdateResult(
        BigInteger price,
        BigInteger nativePrice,
        long timestamp,
        boolean degraded,
        RatioEstimate.Method ratioMethod
) {}
