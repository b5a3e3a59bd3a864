package com.omnioracle.common;

import java.math.BigInteger;

/**
 * Integer fixed-point helpers for the canonical 18-decimal price form. All divisions truncate toward zero.
 */
public final class FixedPoint {

    public static final int DECIMALS = 18;
    public static final BigInteger ONE = BigInteger.TEN.pow(DECIMALS);
    public static final BigInteger BPS = BigInteger.valueOf(10_000);

    /** Fractional bits of the UQ112x112 cumulative price accumulators. */
    public static final int Q112_BITS = 112;

    private static final BigInteger[] POW10 = new BigInteger[78];

    static {
        POW10[0] = BigInteger.ONE;
        for (int i = 1; i < POW10.length; i++) {
            POW10[i] = POW10[i - 1].multiply(BigInteger.TEN);
        }
    }

    private FixedPoint() {}

    public static BigInteger pow10(int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("exponent must be non-negative: " + exponent);
        }
        return exponent < POW10.length ? POW10[exponent] : BigInteger.TEN.pow(exponent);
    }

    /**
     * Rescales a value reported with {@code decimals} fractional digits to 18 fractional digits.
     */
    public static BigInteger rescale(BigInteger value, int decimals) {
        if (decimals == DECIMALS) {
            return value;
        }
        if (decimals < DECIMALS) {
            return value.multiply(pow10(DECIMALS - decimals));
        }
        return value.divide(pow10(decimals - DECIMALS));
    }

    /**
     * Applies a base-10 exponent as reported by confidence-interval feeds: {@code price * 10^(18 + exponent)}.
     */
    public static BigInteger applyExponent(BigInteger price, int exponent) {
        int shift = DECIMALS + exponent;
        if (shift >= 0) {
            return price.multiply(pow10(shift));
        }
        return price.divide(pow10(-shift));
    }

    /**
     * Decimal correction for an asset-per-native ratio: multiply when native has more decimals, divide otherwise.
     */
    public static BigInteger correctDecimals(BigInteger ratio, int nativeDecimals, int assetDecimals) {
        if (nativeDecimals >= assetDecimals) {
            return ratio.multiply(pow10(nativeDecimals - assetDecimals));
        }
        return ratio.divide(pow10(assetDecimals - nativeDecimals));
    }

    /**
     * Converts a UQ112x112 quantity to 18 decimals: {@code (value * 1e18) >> 112}.
     * Scaling happens before the shift so the fractional part survives.
     */
    public static BigInteger fromQ112(BigInteger value) {
        return value.multiply(ONE).shiftRight(Q112_BITS);
    }

    /**
     * Relative deviation of {@code current} against {@code reference} in basis points, truncated.
     */
    public static BigInteger deviationBps(BigInteger current, BigInteger reference) {
        if (reference.signum() == 0) {
            throw new ArithmeticException("reference must be non-zero");
        }
        return current.subtract(reference).abs().multiply(BPS).divide(reference.abs());
    }
}
