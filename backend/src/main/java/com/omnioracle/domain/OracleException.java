package com.omnioracle.domain;

/**
 * Base of all pricing-engine failures. {@link #getCode()} is the stable error code returned to API callers.
 */
public class OracleException extends RuntimeException {

    private final String code;

    public OracleException(String code, String message) {
        super(message);
        this.code = code;
    }

    public OracleException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
