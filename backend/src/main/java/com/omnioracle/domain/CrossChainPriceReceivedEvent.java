package com.omnioracle.domain;

import java.math.BigInteger;

/**
 * Application event: a peer response was cached. {@code adopted} is true when it also became the local price.
 * {@code nativePrice} is zero when the peer did not report one.
 */
public record CrossChainPriceReceivedEvent(long chainId, BigInteger price, BigInteger nativePrice, long timestamp,
                                           boolean adopted) {}
