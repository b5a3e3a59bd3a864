package com.omnioracle.domain;

/**
 * Application event: a remote read was issued to a peer chain.
 */
public record PriceRequestedEvent(String correlationId, long chainId, FeeQuote fee) {}
