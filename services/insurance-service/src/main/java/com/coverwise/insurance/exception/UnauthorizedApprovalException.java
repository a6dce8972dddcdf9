package com.coverwise.insurance.exception;

import com.coverwise.insurance.entity.UserRole;

/**
 * The acting user does not hold the role required by the claim's approval threshold.
 * Results in HTTP 403 Forbidden
 */
public class UnauthorizedApprovalException extends InsuranceException {

    private final UserRole requiredRole;

    public UnauthorizedApprovalException(String userId, UserRole requiredRole) {
        super("APPROVAL_NOT_AUTHORIZED",
              String.format("User '%s' is not authorized to approve this claim; role %s or higher is required",
                          userId, requiredRole),
              userId, requiredRole);
        this.requiredRole = requiredRole;
    }

    public UserRole getRequiredRole() {
        return requiredRole;
    }
}
