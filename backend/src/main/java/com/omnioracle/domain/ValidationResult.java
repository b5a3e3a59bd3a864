package com.omnioracle.domain;

/**
 * Local freshness and whether at least one active peer currently holds a fresh price.
 */
public record ValidationResult(boolean localValid, boolean crossChainValid) {}
