package com.omnioracle.domain;

/**
 * Rejected configuration call: bad source id, out-of-range weight, zero reference, illegal mode.
 */
public class InvalidConfigurationException extends OracleException {

    public InvalidConfigurationException(String message) {
        super("INVALID_CONFIGURATION", message);
    }
}
