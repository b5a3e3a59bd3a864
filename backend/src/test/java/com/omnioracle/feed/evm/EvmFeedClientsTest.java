package com.omnioracle.feed.evm;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.omnioracle.chain.RpcException;
import com.omnioracle.chain.evm.EvmCallExecutor;
import com.omnioracle.common.AbiWords;
import com.omnioracle.feed.client.ConfidencePrice;
import com.omnioracle.feed.client.PullQuoteFeed;
import com.omnioracle.feed.client.PushPrice;
import com.omnioracle.feed.client.ReferenceRate;
import com.omnioracle.feed.client.RoundData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EvmFeedClientsTest {

    private static final String ADDR = "0xAbCdEf0123456789abcdef0123456789ABCDEF01";

    @Mock
    EvmCallExecutor executor;

    private EvmFeedClientFactory factory;

    @BeforeEach
    void setUp() {
        factory = new EvmFeedClientFactory(executor, Caffeine.newBuilder().<String, Integer>build());
    }

    @Test
    @DisplayName("latestRoundData decodes answer and updatedAt")
    void latestRoundData() {
        when(executor.call(ADDR, "0xfeaf968c")).thenReturn(result(
                u(7), AbiWords.encodeInt(BigInteger.valueOf(-3)), u(100), u(1_700_000_000L), u(7)));

        RoundData round = factory.pullQuote(ADDR).latestValue();

        assertThat(round.answer()).isEqualTo(BigInteger.valueOf(-3));
        assertThat(round.updatedAt()).isEqualTo(1_700_000_000L);
    }

    @Test
    @DisplayName("decimals() is read once per feed address")
    void decimalsCached() {
        when(executor.call(ADDR, "0x313ce567")).thenReturn(result(u(8)));

        PullQuoteFeed feed = factory.pullQuote(ADDR);
        assertThat(feed.decimalCount()).isEqualTo(8);
        assertThat(factory.pullQuote(ADDR.toLowerCase()).decimalCount()).isEqualTo(8);

        verify(executor, times(1)).call(ADDR, "0x313ce567");
    }

    @Test
    void shortRoundData_throws() {
        when(executor.call(ADDR, "0xfeaf968c")).thenReturn(result(u(1), u(2)));

        assertThatThrownBy(() -> factory.pullQuote(ADDR).latestValue()).isInstanceOf(RpcException.class);
    }

    @Test
    @DisplayName("getPrice(string) must return exactly two words")
    void structuredPrice() {
        String call = AbiWords.encodeStringCall("0x524f3889", "ETH");
        when(executor.call(ADDR, call)).thenReturn(result(u(2_500_000_000_000L), u(42)), result(u(1), u(2), u(3)));

        PushPrice price = factory.pushAggregate(ADDR).priceFor("ETH");
        assertThat(price.price1e9()).isEqualTo(BigInteger.valueOf(2_500_000_000_000L));
        assertThat(price.timestamp()).isEqualTo(42);

        assertThatThrownBy(() -> factory.pushAggregate(ADDR).priceFor("ETH")).isInstanceOf(RpcException.class);
    }

    @Test
    void referenceData() {
        String call = AbiWords.encodeStringCall("0x65555bcc", "ETH", "USD");
        when(executor.call(ADDR, call)).thenReturn(result(u(5), u(10), u(20)));

        ReferenceRate rate = factory.pushAggregate(ADDR).referenceRate("ETH", "USD");

        assertThat(rate.rate18()).isEqualTo(BigInteger.valueOf(5));
        assertThat(rate.lastUpdated()).isEqualTo(20);
    }

    @Test
    void proxyRead() {
        when(executor.call(ADDR, "0x57de26a4")).thenReturn(result(u(123), u(456)));

        assertThat(factory.proxyRead(ADDR).read().value18()).isEqualTo(BigInteger.valueOf(123));
    }

    @Test
    @DisplayName("getPriceUnsafe decodes signed price and exponent")
    void confidenceInterval() {
        String id = "0x" + "0a".repeat(32);
        when(executor.call(ADDR, "0x96834ad3" + "0a".repeat(32))).thenReturn(result(
                u(250_000_000_000L), u(1000), AbiWords.encodeInt(BigInteger.valueOf(-8)), u(99)));

        ConfidencePrice price = factory.confidenceInterval(ADDR).priceUnsafe(id);

        assertThat(price.price()).isEqualTo(BigInteger.valueOf(250_000_000_000L));
        assertThat(price.exponent()).isEqualTo(-8);
        assertThat(price.publishTime()).isEqualTo(99);
    }

    private static String u(long v) {
        return AbiWords.encodeUint(BigInteger.valueOf(v));
    }

    private static String result(String... words) {
        return "0x" + String.join("", words);
    }
}
