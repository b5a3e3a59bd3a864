package com.omnioracle.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AbiWordsTest {

    private static final String MINUS_ONE = "f".repeat(64);

    @Test
    @DisplayName("int256 decodes two's complement, uint does not")
    void signedAndUnsigned() {
        String hex = "0x" + MINUS_ONE + AbiWords.encodeUint(BigInteger.valueOf(1_700_000_000L));
        assertThat(AbiWords.wordCount(hex)).isEqualTo(2);
        assertThat(AbiWords.int256(hex, 0)).isEqualTo(BigInteger.valueOf(-1));
        assertThat(AbiWords.uint(hex, 0)).isEqualTo(BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE));
        assertThat(AbiWords.uintAsLong(hex, 1)).isEqualTo(1_700_000_000L);
    }

    @Test
    @DisplayName("encodeInt writes negatives in two's complement")
    void encodeInt() {
        assertThat(AbiWords.encodeInt(BigInteger.valueOf(-1))).isEqualTo(MINUS_ONE);
        assertThat(AbiWords.encodeInt(BigInteger.TEN)).isEqualTo("0".repeat(63) + "a");
    }

    @Test
    @DisplayName("address takes the low 20 bytes, lowercased")
    void address() {
        String hex = "0x000000000000000000000000AbCdEf0123456789abcdef0123456789ABCDEF01";
        assertThat(AbiWords.address(hex, 0)).isEqualTo("0xabcdef0123456789abcdef0123456789abcdef01");
    }

    @Test
    @DisplayName("encodeStringCall lays out offsets, lengths and padded data")
    void encodeStringCall() {
        String call = AbiWords.encodeStringCall("0x65555bcc", "S", "USD");
        assertThat(call).startsWith("0x65555bcc");
        String args = "0x" + call.substring(10);
        assertThat(AbiWords.wordCount(args)).isEqualTo(6);
        assertThat(AbiWords.uint(args, 0)).isEqualTo(BigInteger.valueOf(64));
        assertThat(AbiWords.uint(args, 1)).isEqualTo(BigInteger.valueOf(128));
        assertThat(AbiWords.uint(args, 2)).isEqualTo(BigInteger.ONE);
        assertThat(AbiWords.words(args).get(3)).isEqualTo("53" + "0".repeat(62));
        assertThat(AbiWords.uint(args, 4)).isEqualTo(BigInteger.valueOf(3));
        assertThat(AbiWords.words(args).get(5)).isEqualTo("555344" + "0".repeat(58));
    }

    @Test
    void encodeBytes32_rejectsWrongLength() {
        assertThatThrownBy(() -> AbiWords.encodeBytes32("0x1234")).isInstanceOf(IllegalArgumentException.class);
        assertThat(AbiWords.encodeBytes32("0x" + "AB".repeat(32))).isEqualTo("ab".repeat(32));
    }

    @Test
    void shortResult_throws() {
        assertThatThrownBy(() -> AbiWords.uint("0x01", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AbiWords.uintAsLong("0x" + MINUS_ONE, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
