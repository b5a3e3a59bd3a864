package com.omnioracle.state;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder for the local latest price. Readers always see one consistent {@link LocalPrice}.
 */
public class LocalPriceStore {

    private final AtomicReference<LocalPrice> current = new AtomicReference<>(LocalPrice.EMPTY);

    public LocalPrice current() {
        return current.get();
    }

    public void set(BigInteger price, BigInteger nativePrice, long timestamp) {
        current.set(new LocalPrice(price, nativePrice, timestamp));
    }

    /**
     * Replaces the price only when {@code timestamp} is newer than the stored one. A null or non-positive
     * {@code nativePrice} keeps the stored native price.
     *
     * @return true if the price was replaced
     */
    public boolean setIfNewer(BigInteger price, BigInteger nativePrice, long timestamp) {
        boolean hasNative = nativePrice != null && nativePrice.signum() > 0;
        while (true) {
            LocalPrice prev = current.get();
            if (timestamp <= prev.timestamp()) {
                return false;
            }
            LocalPrice next = new LocalPrice(price, hasNative ? nativePrice : prev.nativePrice(), timestamp);
            if (current.compareAndSet(prev, next)) {
                return true;
            }
        }
    }

    public void restore(LocalPrice price) {
        if (price != null) {
            current.set(price);
        }
    }
}
