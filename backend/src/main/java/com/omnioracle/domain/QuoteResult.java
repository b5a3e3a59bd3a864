package com.omnioracle.domain;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Result of one adapter call: either a normalized quote or the reason the source was skipped.
 */
public final class QuoteResult {

    private final NormalizedQuote quote;
    private final QuoteError error;

    private QuoteResult(NormalizedQuote quote, QuoteError error) {
        this.quote = quote;
        this.error = error;
    }

    public static QuoteResult ok(BigInteger price18) {
        return new QuoteResult(new NormalizedQuote(price18, true), null);
    }

    public static QuoteResult unavailable() {
        return new QuoteResult(NormalizedQuote.INVALID, QuoteError.SOURCE_UNAVAILABLE);
    }

    public static QuoteResult stale() {
        return new QuoteResult(NormalizedQuote.INVALID, QuoteError.SOURCE_STALE);
    }

    public boolean isValid() {
        return error == null;
    }

    public NormalizedQuote quote() {
        return quote;
    }

    public Optional<QuoteError> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isValid() ? "QuoteResult[ok " + quote.price18() + "]" : "QuoteResult[" + error + "]";
    }
}
