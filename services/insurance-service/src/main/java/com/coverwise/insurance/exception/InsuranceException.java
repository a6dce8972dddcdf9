package com.coverwise.insurance.exception;

/**
 * Base exception for all insurance engine business-rule violations.
 * Every subclass is deterministic: none of them is retried internally.
 */
public class InsuranceException extends RuntimeException {

    private final String errorCode;
    private final Object[] args;

    public InsuranceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.args = null;
    }

    public InsuranceException(String errorCode, String message, Object... args) {
        super(message);
        this.errorCode = errorCode;
        this.args = args;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object[] getArgs() {
        return args;
    }
}
