package com.omnioracle.feed.client;

import java.math.BigInteger;

/**
 * Latest round of a pull-quote feed: raw answer at the feed's own decimals and its update time (epoch seconds).
 */
public record RoundData(BigInteger answer, long updatedAt) {}
