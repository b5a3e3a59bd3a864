package com.omnioracle.feed;

import com.omnioracle.chain.RpcException;
import com.omnioracle.domain.FeedKind;
import com.omnioracle.domain.FeedSource;
import com.omnioracle.domain.QuoteError;
import com.omnioracle.domain.QuoteResult;
import com.omnioracle.feed.client.FeedClientFactory;
import com.omnioracle.feed.client.PushAggregateFeed;
import com.omnioracle.feed.client.PushPrice;
import com.omnioracle.feed.client.ReferenceRate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PushAggregateAdapterTest {

    private static final long NOW = 1_700_000_000L;
    private static final BigInteger PRICE_2500 = new BigInteger("2500000000000000000000");
    private static final FeedSource SOURCE =
            new FeedSource("band", FeedKind.PUSH_AGGREGATE, "0xband", 30, 3600, true, "ETH");

    @Mock
    FeedClientFactory clients;
    @Mock
    PushAggregateFeed feed;

    private PushAggregateAdapter adapter;

    @BeforeEach
    void setUp() {
        when(clients.pushAggregate("0xband")).thenReturn(feed);
        adapter = new PushAggregateAdapter(clients);
    }

    @Test
    @DisplayName("structured 1e9 price is rescaled and the legacy call is not made")
    void structuredPrice() {
        when(feed.priceFor("ETH")).thenReturn(new PushPrice(BigInteger.valueOf(2_500_000_000_000L), NOW - 5));

        QuoteResult result = adapter.quote(SOURCE, NOW);

        assertThat(result.quote().price18()).isEqualTo(PRICE_2500);
        verify(feed, never()).referenceRate(anyString(), anyString());
    }

    @Test
    @DisplayName("structured failure falls back to the USD reference rate")
    void fallsBackToReferenceRate() {
        when(feed.priceFor("ETH")).thenThrow(new RpcException("format mismatch"));
        when(feed.referenceRate("ETH", "USD")).thenReturn(new ReferenceRate(PRICE_2500, NOW - 100, NOW - 10));

        assertThat(adapter.quote(SOURCE, NOW).quote().price18()).isEqualTo(PRICE_2500);
    }

    @Test
    @DisplayName("reference rate staleness uses the later of the two update times")
    void referenceRateStaleness() {
        when(feed.priceFor("ETH")).thenThrow(new RpcException("reverted"));
        when(feed.referenceRate("ETH", "USD")).thenReturn(
                new ReferenceRate(PRICE_2500, NOW - 5000, NOW - 10),
                new ReferenceRate(PRICE_2500, NOW - 5000, NOW - 4000));

        assertThat(adapter.quote(SOURCE, NOW).isValid()).isTrue();
        assertThat(adapter.quote(SOURCE, NOW).error()).contains(QuoteError.SOURCE_STALE);
    }

    @Test
    void structuredStale_isStale() {
        when(feed.priceFor("ETH")).thenReturn(new PushPrice(BigInteger.ONE, NOW - 3601));

        assertThat(adapter.quote(SOURCE, NOW).error()).contains(QuoteError.SOURCE_STALE);
    }

    @Test
    void zeroRate_isUnavailable() {
        when(feed.priceFor("ETH")).thenThrow(new RpcException("reverted"));
        when(feed.referenceRate("ETH", "USD")).thenReturn(new ReferenceRate(BigInteger.ZERO, NOW, NOW));

        assertThat(adapter.quote(SOURCE, NOW).error()).contains(QuoteError.SOURCE_UNAVAILABLE);
    }

    @Test
    void bothCallsFail_isUnavailable() {
        when(feed.priceFor("ETH")).thenThrow(new RpcException("reverted"));
        when(feed.referenceRate("ETH", "USD")).thenThrow(new RpcException("reverted"));

        assertThat(adapter.quote(SOURCE, NOW).error()).contains(QuoteError.SOURCE_UNAVAILABLE);
    }
}
