package com.omnioracle.chain;

/**
 * JSON-RPC error object returned by the node for a call (revert, bad selector). Not retried.
 */
public class ContractRevertException extends RpcException {

    public ContractRevertException(String message) {
        super(message);
    }
}
