package com.omnioracle.common;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal ABI word codec for eth_call payloads: 32-byte big-endian words, hex encoded.
 */
public final class AbiWords {

    public static final int WORD_HEX = 64;
    private static final BigInteger TWO_256 = BigInteger.ONE.shiftLeft(256);
    private static final BigInteger INT256_MAX = BigInteger.ONE.shiftLeft(255).subtract(BigInteger.ONE);

    private AbiWords() {}

    /** Number of complete words in a 0x-prefixed result. */
    public static int wordCount(String hex) {
        return strip(hex).length() / WORD_HEX;
    }

    public static BigInteger uint(String hex, int index) {
        return new BigInteger(word(hex, index), 16);
    }

    /** Unsigned word that must fit a long (timestamps, small counters). */
    public static long uintAsLong(String hex, int index) {
        BigInteger value = uint(hex, index);
        if (value.bitLength() > 63) {
            throw new IllegalArgumentException("word " + index + " does not fit in a long");
        }
        return value.longValue();
    }

    /** Two's complement int256 decode. */
    public static BigInteger int256(String hex, int index) {
        BigInteger raw = uint(hex, index);
        return raw.compareTo(INT256_MAX) > 0 ? raw.subtract(TWO_256) : raw;
    }

    /** Address is the low 20 bytes of the word; returned lowercase with 0x prefix. */
    public static String address(String hex, int index) {
        return "0x" + word(hex, index).substring(24).toLowerCase();
    }

    public static String encodeUint(BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("uint cannot be negative");
        }
        return pad(value.toString(16));
    }

    public static String encodeInt(BigInteger value) {
        return pad((value.signum() < 0 ? value.add(TWO_256) : value).toString(16));
    }

    /** bytes32 argument, e.g. a feed id given as 0x + 64 hex chars. */
    public static String encodeBytes32(String hex) {
        String raw = strip(hex);
        if (raw.length() != WORD_HEX || !raw.matches("[0-9a-fA-F]+")) {
            throw new IllegalArgumentException("bytes32 must be 64 hex chars");
        }
        return raw.toLowerCase();
    }

    /**
     * Encodes a call with only dynamic string arguments: head of offsets, then length-prefixed padded data.
     */
    public static String encodeStringCall(String selector, String... args) {
        StringBuilder head = new StringBuilder();
        StringBuilder tail = new StringBuilder();
        int offset = args.length * 32;
        for (String arg : args) {
            head.append(encodeUint(BigInteger.valueOf(offset)));
            byte[] bytes = arg.getBytes(StandardCharsets.UTF_8);
            String data = toHex(bytes);
            int paddedLen = ((data.length() + WORD_HEX - 1) / WORD_HEX) * WORD_HEX;
            tail.append(encodeUint(BigInteger.valueOf(bytes.length)));
            tail.append(data).append("0".repeat(paddedLen - data.length()));
            offset += 32 + paddedLen / 2;
        }
        return selector + head + tail;
    }

    /** Splits a result into its words. */
    public static List<String> words(String hex) {
        String raw = strip(hex);
        List<String> out = new ArrayList<>();
        for (int i = 0; i + WORD_HEX <= raw.length(); i += WORD_HEX) {
            out.add(raw.substring(i, i + WORD_HEX));
        }
        return out;
    }

    private static String word(String hex, int index) {
        String raw = strip(hex);
        int start = index * WORD_HEX;
        if (index < 0 || raw.length() < start + WORD_HEX) {
            throw new IllegalArgumentException("ABI result too short for word " + index);
        }
        return raw.substring(start, start + WORD_HEX);
    }

    private static String strip(String hex) {
        if (hex == null) {
            return "";
        }
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }

    private static String pad(String hex) {
        if (hex.length() > WORD_HEX) {
            throw new IllegalArgumentException("value exceeds 256 bits");
        }
        return "0".repeat(WORD_HEX - hex.length()) + hex;
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }
}
