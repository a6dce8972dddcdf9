package com.coverwise.insurance.exception;

/**
 * Exception thrown when an operation is attempted on a record in a state that does not permit it.
 * For example: accepting a quote that was already rejected
 * Results in HTTP 409 Conflict
 */
public class InvalidStateException extends InsuranceException {

    public InvalidStateException(String entity, String currentState, String requiredState) {
        super("INVALID_STATE",
              String.format("%s is in state '%s' but operation requires state '%s'",
                          entity, currentState, requiredState),
              entity, currentState, requiredState);
    }

    public InvalidStateException(String message) {
        super("INVALID_STATE", message);
    }
}
