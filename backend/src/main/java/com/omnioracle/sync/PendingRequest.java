package com.omnioracle.sync;

import com.omnioracle.domain.FeeQuote;

public record PendingRequest(String correlationId, long chainId, long issuedAt, FeeQuote fee) {}
