package com.omnioracle.domain;

public class RatioUnavailableException extends OracleException {

    public RatioUnavailableException(String message) {
        super("RATIO_UNAVAILABLE", message);
    }
}
