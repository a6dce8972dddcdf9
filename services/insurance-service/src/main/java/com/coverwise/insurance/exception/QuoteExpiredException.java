package com.coverwise.insurance.exception;

import java.time.LocalDateTime;

/**
 * Exception thrown when a quote is used after its validity window closed.
 * Results in HTTP 410 Gone
 */
public class QuoteExpiredException extends InsuranceException {

    public QuoteExpiredException(String quoteNumber, LocalDateTime expiredAt) {
        super("QUOTE_EXPIRED",
              String.format("Quote %s expired at %s", quoteNumber, expiredAt),
              quoteNumber, expiredAt);
    }
}
