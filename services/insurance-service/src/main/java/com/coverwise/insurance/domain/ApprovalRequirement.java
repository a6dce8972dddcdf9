package com.coverwise.insurance.domain;

import com.coverwise.insurance.entity.ClaimApprovalThreshold;
import com.coverwise.insurance.entity.UserRole;

/**
 * Approval tier a claim falls into.
 *
 * @param threshold null when no active threshold matched and the fail-closed default applies
 */
public record ApprovalRequirement(
    ClaimApprovalThreshold threshold,
    UserRole requiredRole
) {
    public static ApprovalRequirement of(ClaimApprovalThreshold threshold) {
        return new ApprovalRequirement(threshold, threshold.getRequiredApproverRole());
    }

    public static ApprovalRequirement failClosed() {
        return new ApprovalRequirement(null, UserRole.highestPrivilege());
    }

    public boolean isFallback() {
        return threshold == null;
    }
}
