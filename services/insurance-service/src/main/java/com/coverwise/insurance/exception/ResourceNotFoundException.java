package com.coverwise.insurance.exception;

import java.util.UUID;

/**
 * Results in HTTP 404 Not Found
 */
public class ResourceNotFoundException extends InsuranceException {

    public ResourceNotFoundException(String resource, UUID id) {
        super("RESOURCE_NOT_FOUND", String.format("%s not found: %s", resource, id), resource, id);
    }
}
