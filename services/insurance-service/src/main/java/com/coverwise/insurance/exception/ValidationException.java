package com.coverwise.insurance.exception;

/**
 * Malformed or missing required input, e.g. a rejection without a reason
 * or an approved amount above the requested amount.
 * Results in HTTP 400 Bad Request
 */
public class ValidationException extends InsuranceException {

    private final String field;

    public ValidationException(String field, String message) {
        super("VALIDATION_FAILED", message, field);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
