package com.coverwise.insurance.entity;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Claim status enumeration driving the claims workflow.
 *
 * <h3>Status Flow:</h3>
 * <pre>
 * SUBMITTED → UNDER_REVIEW → SURVEYOR_ASSIGNED → UNDER_INVESTIGATION → ASSESSED
 *                  ↓                                                     ↓
 *          APPROVED / REJECTED  ←───────────────────────────────  APPROVED / REJECTED
 *              ↓          ↓
 *           SETTLED → CLOSED ← REJECTED
 * </pre>
 *
 * <p>The status is the single source of truth for which claim mutations are legal.
 * {@link #canTransitionTo(ClaimStatus)} is the complete transition table.</p>
 */
public enum ClaimStatus {

    SUBMITTED("Claim submitted"),
    UNDER_REVIEW("Under review"),
    SURVEYOR_ASSIGNED("Surveyor assigned"),
    UNDER_INVESTIGATION("Under investigation"),
    ASSESSED("Assessment completed"),
    APPROVED("Approved"),
    REJECTED("Rejected"),
    SETTLED("Settled"),
    CLOSED("Closed");

    private final String description;

    ClaimStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Targets reachable from this status in one step.
     */
    public Set<ClaimStatus> allowedTargets() {
        switch (this) {
            case SUBMITTED:
                return EnumSet.of(UNDER_REVIEW);
            case UNDER_REVIEW:
                return EnumSet.of(APPROVED, REJECTED, SURVEYOR_ASSIGNED);
            case SURVEYOR_ASSIGNED:
                return EnumSet.of(UNDER_INVESTIGATION);
            case UNDER_INVESTIGATION:
                return EnumSet.of(ASSESSED);
            case ASSESSED:
                return EnumSet.of(APPROVED, REJECTED);
            case APPROVED:
                return EnumSet.of(SETTLED);
            case SETTLED:
            case REJECTED:
                return EnumSet.of(CLOSED);
            case CLOSED:
            default:
                return Collections.emptySet();
        }
    }

    public boolean canTransitionTo(ClaimStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    /**
     * No outgoing transitions.
     */
    public boolean isTerminal() {
        return this == CLOSED;
    }

    /**
     * Processing is finished for SLA purposes: the claim was paid out, turned down, or closed.
     */
    public boolean isResolved() {
        return this == SETTLED || this == REJECTED || this == CLOSED;
    }
}
