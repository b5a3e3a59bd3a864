package com.omnioracle.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON-RPC access to the local chain, where feed and pool contracts live.
 */
@ConfigurationProperties(prefix = "omnioracle.rpc")
@NoArgsConstructor
@Getter
@Setter
public class RpcProperties {

    /** RPC endpoint URLs, used round-robin. */
    private List<String> urls = new ArrayList<>();

    /** Global eth_call budget per second for this instance. */
    private int maxRequestsPerSecond = 50;

    /** How long a call may wait for a rate-limit permit before failing. */
    private long limiterTimeoutMs = 500;

    /** Per-call timeout. */
    private long callTimeoutMs = 5_000;

    private Retry retry = new Retry();

    public void setUrls(List<String> urls) {
        this.urls = urls != null ? urls : new ArrayList<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {
        /** Base delay in ms for the first retry; doubles each attempt. */
        private long baseDelayMs = 250L;
        /** Jitter factor 0..1 (0.2 = ±20%). */
        private double jitterFactor = 0.2;
        /** Total attempts per call, including the first. */
        private int maxAttempts = 3;
    }
}
