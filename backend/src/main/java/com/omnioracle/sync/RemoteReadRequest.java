package com.omnioracle.sync;

/**
 * Outbound read command. {@code callSelector} names the entry point to call on the remote oracle.
 */
public record RemoteReadRequest(
        String correlationId,
        long targetChainId,
        String targetRef,
        String callSelector,
        long timestampHint,
        int confirmations
) {}
