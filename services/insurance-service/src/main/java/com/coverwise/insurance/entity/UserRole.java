package com.coverwise.insurance.entity;

/**
 * Platform roles with an explicit approval hierarchy.
 *
 * <p>Only the approver roles carry a positive approval rank. A role satisfies a
 * required approver role when it is itself an approver and ranks at least as high,
 * so a director may approve anything a manager may. {@link #ADMIN} is the
 * highest-privilege role and the fail-closed requirement when no threshold matches.</p>
 */
public enum UserRole {

    CUSTOMER(0),
    SURVEYOR(0),
    CLAIMS_OFFICER(1),
    CLAIMS_MANAGER(2),
    CLAIMS_DIRECTOR(3),
    ADMIN(4);

    private final int approvalRank;

    UserRole(int approvalRank) {
        this.approvalRank = approvalRank;
    }

    public int getApprovalRank() {
        return approvalRank;
    }

    public boolean isApprover() {
        return approvalRank > 0;
    }

    public boolean satisfies(UserRole required) {
        if (required == null || !isApprover()) {
            return false;
        }
        return approvalRank >= required.approvalRank;
    }

    public static UserRole highestPrivilege() {
        return ADMIN;
    }
}
