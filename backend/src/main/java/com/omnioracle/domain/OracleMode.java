package com.omnioracle.domain;

/**
 * Role of an oracle instance. Once left, UNINITIALIZED cannot be re-entered.
 */
public enum OracleMode {
    UNINITIALIZED,
    /** Aggregates feeds locally and serves reads to peers. */
    PRODUCER,
    /** Only ingests peer-published prices. */
    CONSUMER
}
