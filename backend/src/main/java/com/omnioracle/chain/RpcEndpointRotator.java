package com.omnioracle.chain;

import com.omnioracle.common.RetryPolicy;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin selection over the local chain's RPC endpoints; each retry moves to the next endpoint.
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger cursor = new AtomicInteger();
    private final RetryPolicy retryPolicy;

    public RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one RPC endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    public String next() {
        return endpoints.get(Math.floorMod(cursor.getAndIncrement(), endpoints.size()));
    }

    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int maxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    public List<String> endpoints() {
        return endpoints;
    }
}
