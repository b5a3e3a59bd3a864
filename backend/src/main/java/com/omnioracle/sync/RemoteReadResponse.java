package com.omnioracle.sync;

/**
 * Inbound answer to a {@link RemoteReadRequest}; {@code payload} is the ABI-encoded return data.
 */
public record RemoteReadResponse(String correlationId, String payload) {}
