package com.omnioracle.domain;

import java.math.BigInteger;

/**
 * Cost of one remote read, in native wei and in messaging-token units.
 */
public record FeeQuote(BigInteger nativeFee, BigInteger lzTokenFee) {}
