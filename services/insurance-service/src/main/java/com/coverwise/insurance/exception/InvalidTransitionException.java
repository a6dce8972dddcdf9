package com.coverwise.insurance.exception;

import com.coverwise.insurance.entity.ClaimStatus;

/**
 * Exception thrown when a claim status change is not in the workflow transition table.
 * Results in HTTP 409 Conflict
 */
public class InvalidTransitionException extends InsuranceException {

    private final ClaimStatus from;
    private final ClaimStatus to;

    public InvalidTransitionException(ClaimStatus from, ClaimStatus to) {
        super("INVALID_TRANSITION",
              String.format("Claim cannot move from '%s' to '%s'", from, to),
              from, to);
        this.from = from;
        this.to = to;
    }

    public ClaimStatus getFrom() {
        return from;
    }

    public ClaimStatus getTo() {
        return to;
    }
}
