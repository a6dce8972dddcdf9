package com.coverwise.insurance.exception;

/**
 * A downstream operation's precondition is unmet, e.g. settling a claim with no approved amount.
 * Results in HTTP 412 Precondition Failed
 */
public class PreconditionFailedException extends InsuranceException {

    public PreconditionFailedException(String message) {
        super("PRECONDITION_FAILED", message);
    }
}
