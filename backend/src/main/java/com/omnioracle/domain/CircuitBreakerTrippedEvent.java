package com.omnioracle.domain;

import java.math.BigInteger;

public record CircuitBreakerTrippedEvent(BigInteger candidate, BigInteger reference, BigInteger deviationBps) {}
