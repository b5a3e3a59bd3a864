package com.omnioracle.domain;

/**
 * Application event: operator configuration changed state that is part of the durable snapshot.
 */
public record OracleStateChangedEvent(String reason) {}
