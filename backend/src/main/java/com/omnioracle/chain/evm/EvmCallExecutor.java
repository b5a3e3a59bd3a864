package com.omnioracle.chain.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.omnioracle.chain.ContractRevertException;
import com.omnioracle.chain.RpcEndpointRotator;
import com.omnioracle.chain.RpcException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Blocking {@code eth_call} against the "latest" block with endpoint rotation, backoff and a shared rate limit.
 * Never call from a reactor event-loop thread.
 */
@Slf4j
public class EvmCallExecutor {

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final Duration callTimeout;

    public EvmCallExecutor(EvmRpcClient rpcClient, RpcEndpointRotator rotator, RateLimiter rateLimiter,
                           ObjectMapper objectMapper, Duration callTimeout) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.callTimeout = callTimeout;
    }

    /**
     * Executes a read-only call and returns the 0x-prefixed result.
     *
     * @throws RpcException when every attempt failed or the contract reverted
     */
    public String call(String to, String data) {
        List<Object> params = List.of(Map.of("to", to, "data", data), "latest");
        RpcException last = null;
        for (int attempt = 0; attempt < rotator.maxAttempts(); attempt++) {
            if (attempt > 0) {
                sleep(rotator.retryDelayMs(attempt - 1));
            }
            if (!rateLimiter.acquirePermission()) {
                last = new RpcException("Local RPC rate limit exhausted");
                continue;
            }
            String endpoint = rotator.next();
            try {
                String json = rpcClient.call(endpoint, "eth_call", params).block(callTimeout);
                return parseResult(json, to);
            } catch (ContractRevertException e) {
                throw e;
            } catch (RpcException e) {
                last = e;
                log.debug("eth_call to {} via {} failed (attempt {}): {}", to, endpoint, attempt + 1, e.getMessage());
            } catch (RuntimeException e) {
                last = new RpcException("eth_call transport failure: " + e.getMessage(), e);
                log.debug("eth_call to {} via {} transport failure (attempt {})", to, endpoint, attempt + 1, e);
            }
        }
        throw last != null ? last : new RpcException("eth_call not attempted");
    }

    private String parseResult(String json, String to) {
        if (json == null) {
            throw new RpcException("Empty response for eth_call to " + to);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new RpcException("Malformed JSON-RPC response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new ContractRevertException("eth_call error for " + to + ": " + error.path("message").asText(error.toString()));
        }
        String result = root.path("result").asText(null);
        if (result == null || !result.startsWith("0x") || result.length() <= 2) {
            throw new RpcException("Empty eth_call result for " + to);
        }
        return result;
    }

    private static void sleep(long ms) {
        if (ms <= 0) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted while backing off", e);
        }
    }
}
