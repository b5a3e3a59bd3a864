package com.omnioracle.pricing;

import com.omnioracle.common.FixedPoint;
import com.omnioracle.domain.RatioUnavailableException;

import java.math.BigInteger;

/**
 * Asset/USD from native/USD and an asset-per-native ratio: {@code nativeUsd * 1e18 / ratio18}.
 * <p>
 * Example: native at 2500 USD, ratio 2500 asset per native: asset price is 1 USD.
 */
public class DerivedPriceComposer {

    public BigInteger compose(BigInteger nativeUsd18, BigInteger assetPerNative18) {
        if (assetPerNative18 == null || assetPerNative18.signum() <= 0) {
            throw new RatioUnavailableException("Asset/native ratio is zero or undefined");
        }
        if (nativeUsd18 == null || nativeUsd18.signum() <= 0) {
            throw new RatioUnavailableException("Native price is non-positive");
        }
        return nativeUsd18.multiply(FixedPoint.ONE).divide(assetPerNative18);
    }
}
