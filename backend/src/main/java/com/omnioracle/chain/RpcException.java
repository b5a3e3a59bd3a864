package com.omnioracle.chain;

/**
 * Thrown when a JSON-RPC read fails: HTTP error, JSON-RPC error object, revert, or malformed result.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
