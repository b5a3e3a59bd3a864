package com.omnioracle.domain;

import java.math.BigInteger;

/**
 * Adapter output in canonical form: signed fixed-point price with 18 fractional digits.
 */
public record NormalizedQuote(BigInteger price18, boolean valid) {

    public static final NormalizedQuote INVALID = new NormalizedQuote(BigInteger.ZERO, false);
}
