package com.omnioracle.domain;

/**
 * Thrown when live aggregation misses the minimum-source bar and no usable fallback exists.
 */
public class InsufficientSourcesException extends OracleException {

    private final int validCount;
    private final int required;

    public InsufficientSourcesException(int validCount, int required) {
        super("INSUFFICIENT_SOURCES", "Only " + validCount + " valid sources, " + required + " required, no usable fallback");
        this.validCount = validCount;
        this.required = required;
    }

    public int getValidCount() {
        return validCount;
    }

    public int getRequired() {
        return required;
    }
}
