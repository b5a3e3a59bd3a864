package com.omnioracle.domain;

import java.math.BigInteger;

/**
 * Outcome of one aggregation pass. {@code degraded} marks lone-source and fallback-cache results.
 */
public record AggregatedResult(BigInteger price18, long timestamp, boolean degraded) {}
