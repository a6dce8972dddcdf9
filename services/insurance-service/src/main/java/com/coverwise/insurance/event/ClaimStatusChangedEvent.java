package com.coverwise.insurance.event;

import com.coverwise.insurance.entity.ClaimStatus;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Published once the transition has committed, for notification and disbursement listeners.
 * A transition that rolls back publishes nothing.
 *
 * @param oldStatus null for a newly submitted claim
 */
public record ClaimStatusChangedEvent(
    UUID claimId,
    String claimNumber,
    ClaimStatus oldStatus,
    ClaimStatus newStatus,
    String changedBy,
    LocalDateTime changedAt
) {
}
