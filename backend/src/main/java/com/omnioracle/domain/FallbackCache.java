package com.omnioracle.domain;

import java.math.BigInteger;

/**
 * Last successful aggregation. Usable only while younger than the fallback horizon.
 */
public record FallbackCache(BigInteger price18, long timestamp) {

    public boolean isUsable(long nowSeconds, long maxAgeSeconds) {
        return timestamp > 0 && price18 != null && nowSeconds - timestamp <= maxAgeSeconds;
    }
}
