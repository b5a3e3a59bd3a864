package com.omnioracle.domain;

/**
 * Operation not allowed in the current mode or while emergency override is active.
 */
public class OracleStateException extends OracleException {

    public static final String MODE_VIOLATION = "MODE_VIOLATION";
    public static final String EMERGENCY_ACTIVE = "EMERGENCY_ACTIVE";

    public OracleStateException(String code, String message) {
        super(code, message);
    }
}
