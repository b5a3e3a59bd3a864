package com.omnioracle.domain;

public class CircuitBreakerOpenException extends OracleException {

    public static final String OPEN = "CIRCUIT_BREAKER_OPEN";
    public static final String DEVIATION_EXCEEDED = "DEVIATION_EXCEEDED";

    public CircuitBreakerOpenException(String code, String message) {
        super(code, message);
    }
}
