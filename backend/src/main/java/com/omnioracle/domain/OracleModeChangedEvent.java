package com.omnioracle.domain;

public record OracleModeChangedEvent(OracleMode previous, OracleMode current) {}
