package com.omnioracle.sync;

import com.omnioracle.common.AbiWords;
import com.omnioracle.domain.LatestPrice;
import com.omnioracle.domain.RemoteReadException;

import java.math.BigInteger;

/**
 * ABI codec for the {@code getLatestPrice() -> (int256 price, uint256 timestamp[, int256 nativePrice])} read.
 * The native price word is optional: two-word payloads decode with a zero native price.
 */
public final class RemoteReadCodec {

    /** keccak256("getLatestPrice()")[0:4]. */
    public static final String GET_LATEST_PRICE_SELECTOR = "0x8e15f473";

    private RemoteReadCodec() {}

    public static String encodeLatestPrice(LatestPrice price) {
        return "0x" + AbiWords.encodeInt(price.price()) + AbiWords.encodeUint(BigInteger.valueOf(price.timestamp()));
    }

    public static String encodeLatestPrice(LatestPrice price, BigInteger nativePrice) {
        return encodeLatestPrice(price) + AbiWords.encodeInt(nativePrice != null ? nativePrice : BigInteger.ZERO);
    }

    /**
     * @throws RemoteReadException with {@link RemoteReadException#PAYLOAD_INVALID} on a malformed payload
     */
    public static LatestPrice decodeLatestPrice(String payload) {
        RemotePrice decoded = decode(payload);
        return new LatestPrice(decoded.price(), decoded.timestamp());
    }

    /**
     * @throws RemoteReadException with {@link RemoteReadException#PAYLOAD_INVALID} on a malformed payload
     */
    public static RemotePrice decode(String payload) {
        try {
            int words = payload == null ? 0 : AbiWords.wordCount(payload);
            if (words != 2 && words != 3) {
                throw new RemoteReadException(RemoteReadException.PAYLOAD_INVALID, "Expected 2 or 3 ABI words");
            }
            BigInteger nativePrice = words == 3 ? AbiWords.int256(payload, 2) : BigInteger.ZERO;
            return new RemotePrice(AbiWords.int256(payload, 0), nativePrice, AbiWords.uintAsLong(payload, 1));
        } catch (IllegalArgumentException e) {
            throw new RemoteReadException(RemoteReadException.PAYLOAD_INVALID, "Malformed payload: " + e.getMessage(), e);
        }
    }

    public static boolean isLatestPriceSelector(String selector) {
        return selector != null && GET_LATEST_PRICE_SELECTOR.equalsIgnoreCase(selector.strip());
    }

    /** Decoded peer answer. */
    public record RemotePrice(BigInteger price, BigInteger nativePrice, long timestamp) {}
}
