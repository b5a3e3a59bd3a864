package com.omnioracle.feed.client;

import java.math.BigInteger;

public record ProxyValue(BigInteger value18, long timestamp) {}
