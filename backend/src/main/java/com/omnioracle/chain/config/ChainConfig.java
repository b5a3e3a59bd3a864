package com.omnioracle.chain.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.omnioracle.chain.RpcEndpointRotator;
import com.omnioracle.chain.evm.EvmCallExecutor;
import com.omnioracle.chain.evm.EvmRpcClient;
import com.omnioracle.chain.evm.WebClientEvmRpcClient;
import com.omnioracle.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * RPC plumbing shared by feed clients and liquidity pools.
 */
@Configuration
@EnableConfigurationProperties(RpcProperties.class)
public class ChainConfig {

    /** Used when omnioracle.rpc.urls is empty so the context still starts; feeds then report unavailable. */
    private static final List<String> DEFAULT_FALLBACK_URLS = List.of("https://rpc.soniclabs.com");

    @Bean
    public RpcEndpointRotator rpcEndpointRotator(RpcProperties properties) {
        RpcProperties.Retry retry = properties.getRetry();
        RetryPolicy policy = new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
        List<String> urls = properties.getUrls().isEmpty() ? DEFAULT_FALLBACK_URLS : properties.getUrls();
        return new RpcEndpointRotator(urls, policy);
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(RpcProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }

    @Bean
    public EvmCallExecutor evmCallExecutor(EvmRpcClient evmRpcClient, RpcEndpointRotator rpcEndpointRotator,
                                           RateLimiter evmRpcRateLimiter, ObjectMapper objectMapper,
                                           RpcProperties properties) {
        return new EvmCallExecutor(evmRpcClient, rpcEndpointRotator, evmRpcRateLimiter, objectMapper,
                Duration.ofMillis(properties.getCallTimeoutMs()));
    }
}
