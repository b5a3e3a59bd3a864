package com.omnioracle.chain.evm;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport. Retries, rotation and throttling live in {@link EvmCallExecutor}.
 */
public interface EvmRpcClient {

    /**
     * Single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_call"
     * @param params      method params
     * @return raw JSON response body
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
