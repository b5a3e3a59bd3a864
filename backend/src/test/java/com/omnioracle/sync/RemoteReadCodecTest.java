package com.omnioracle.sync;

import com.omnioracle.domain.LatestPrice;
import com.omnioracle.domain.RemoteReadException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemoteReadCodecTest {

    @Test
    void encodesPriceAndTimestampAsTwoWords() {
        String payload = RemoteReadCodec.encodeLatestPrice(new LatestPrice(BigInteger.valueOf(255), 16));

        assertThat(payload).isEqualTo("0x" + "0".repeat(62) + "ff" + "0".repeat(62) + "10");
        assertThat(RemoteReadCodec.decodeLatestPrice(payload)).isEqualTo(new LatestPrice(BigInteger.valueOf(255), 16));
    }

    @Test
    void thirdWordCarriesNativePrice() {
        String payload = RemoteReadCodec.encodeLatestPrice(new LatestPrice(BigInteger.valueOf(255), 16), BigInteger.valueOf(32));

        assertThat(payload).isEqualTo("0x" + "0".repeat(62) + "ff" + "0".repeat(62) + "10" + "0".repeat(62) + "20");
        assertThat(RemoteReadCodec.decode(payload))
                .isEqualTo(new RemoteReadCodec.RemotePrice(BigInteger.valueOf(255), BigInteger.valueOf(32), 16));
        assertThat(RemoteReadCodec.decodeLatestPrice(payload)).isEqualTo(new LatestPrice(BigInteger.valueOf(255), 16));
    }

    @Test
    void twoWordPayload_decodesWithZeroNativePrice() {
        String payload = RemoteReadCodec.encodeLatestPrice(new LatestPrice(BigInteger.TEN, 16));

        assertThat(RemoteReadCodec.decode(payload).nativePrice()).isZero();
    }

    @Test
    void wrongWordCount_isPayloadInvalid() {
        assertThatThrownBy(() -> RemoteReadCodec.decodeLatestPrice("0x" + "0".repeat(64)))
                .isInstanceOf(RemoteReadException.class)
                .extracting(e -> ((RemoteReadException) e).getCode())
                .isEqualTo(RemoteReadException.PAYLOAD_INVALID);
        assertThatThrownBy(() -> RemoteReadCodec.decodeLatestPrice(null))
                .isInstanceOf(RemoteReadException.class);
    }

    @Test
    void nonHexPayload_isPayloadInvalid() {
        assertThatThrownBy(() -> RemoteReadCodec.decodeLatestPrice("0x" + "zz".repeat(64)))
                .isInstanceOf(RemoteReadException.class);
    }

    @Test
    void selectorMatchIgnoresCase() {
        assertThat(RemoteReadCodec.isLatestPriceSelector("0x8E15F473")).isTrue();
        assertThat(RemoteReadCodec.isLatestPriceSelector("0xfeaf968c")).isFalse();
        assertThat(RemoteReadCodec.isLatestPriceSelector(null)).isFalse();
    }
}
