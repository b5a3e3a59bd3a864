package com.omnioracle.chain.evm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.omnioracle.chain.ContractRevertException;
import com.omnioracle.chain.RpcEndpointRotator;
import com.omnioracle.chain.RpcException;
import com.omnioracle.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EvmCallExecutorTest {

    private static final String FEED = "0x1111111111111111111111111111111111111111";
    private static final String OK = "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x" + "0".repeat(63) + "8\"}";

    @Mock
    EvmRpcClient rpcClient;

    private EvmCallExecutor executor;

    @BeforeEach
    void setUp() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("https://a", "https://b"), new RetryPolicy(0, 0, 3));
        RateLimiter limiter = RateLimiter.of("test", RateLimiterConfig.custom()
                .limitForPeriod(100)
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(Duration.ZERO)
                .build());
        executor = new EvmCallExecutor(rpcClient, rotator, limiter, new ObjectMapper(), Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("returns the result word on success")
    void success() {
        when(rpcClient.call(eq("https://a"), eq("eth_call"), any())).thenReturn(Mono.just(OK));

        assertThat(executor.call(FEED, "0x313ce567")).isEqualTo("0x" + "0".repeat(63) + "8");
    }

    @Test
    @DisplayName("transport failure moves to the next endpoint")
    void retriesOnNextEndpoint() {
        when(rpcClient.call(eq("https://a"), eq("eth_call"), any())).thenReturn(Mono.error(new RpcException("down")));
        when(rpcClient.call(eq("https://b"), eq("eth_call"), any())).thenReturn(Mono.just(OK));

        assertThat(executor.call(FEED, "0x313ce567")).endsWith("8");
        verify(rpcClient).call(eq("https://a"), eq("eth_call"), any());
        verify(rpcClient).call(eq("https://b"), eq("eth_call"), any());
    }

    @Test
    @DisplayName("a JSON-RPC error is a revert and is not retried")
    void revertNotRetried() {
        when(rpcClient.call(eq("https://a"), eq("eth_call"), any()))
                .thenReturn(Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":3,\"message\":\"execution reverted\"}}"));

        assertThatThrownBy(() -> executor.call(FEED, "0xfeaf968c"))
                .isInstanceOf(ContractRevertException.class)
                .hasMessageContaining("execution reverted");
        verify(rpcClient, times(1)).call(anyString(), eq("eth_call"), any());
    }

    @Test
    @DisplayName("exhausted attempts raise the last failure")
    void allAttemptsFail() {
        when(rpcClient.call(anyString(), eq("eth_call"), any())).thenReturn(Mono.error(new RpcException("down")));

        assertThatThrownBy(() -> executor.call(FEED, "0xfeaf968c")).isInstanceOf(RpcException.class);
        verify(rpcClient, times(3)).call(anyString(), eq("eth_call"), any());
    }

    @Test
    @DisplayName("empty 0x result is a failure")
    void emptyResult() {
        when(rpcClient.call(anyString(), eq("eth_call"), any()))
                .thenReturn(Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x\"}"));

        assertThatThrownBy(() -> executor.call(FEED, "0xfeaf968c"))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("Empty eth_call result");
    }
}
