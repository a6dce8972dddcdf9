package com.coverwise.insurance.entity;

import com.coverwise.insurance.exception.InvalidTransitionException;
import com.coverwise.insurance.exception.PreconditionFailedException;
import com.coverwise.insurance.exception.ValidationException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Insurance claim. Status and the amount fields change only through the transition
 * methods below, each of which validates the whole change before touching any field.
 */
@Entity
@Table(name = "claims", indexes = {
    @Index(name = "idx_claim_customer", columnList = "customer_id"),
    @Index(name = "idx_claim_status", columnList = "status")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Claim {

    private static final Set<ClaimStatus> PLAIN_TARGETS =
            EnumSet.of(ClaimStatus.SURVEYOR_ASSIGNED, ClaimStatus.UNDER_INVESTIGATION, ClaimStatus.ASSESSED);

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    /**
     * Optimistic lock; a concurrent writer that lost the race fails on flush
     */
    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "claim_number", unique = true, nullable = false, length = 30)
    private String claimNumber;

    @Column(name = "policy_number", length = 50)
    private String policyNumber;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "customer_id", nullable = false, updatable = false)
    private CustomerProfile customer;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "insurance_type_id", nullable = false, updatable = false)
    private InsuranceType insuranceType;

    @Enumerated(EnumType.STRING)
    @Column(name = "claim_type", nullable = false, length = 30)
    private ClaimType claimType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private ClaimStatus status;

    @Column(name = "incident_date", nullable = false)
    private LocalDate incidentDate;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "amount_requested", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amountRequested;

    @Column(name = "amount_approved", precision = 19, scale = 4)
    private BigDecimal amountApproved;

    @Column(name = "amount_settled", precision = 19, scale = 4)
    private BigDecimal amountSettled;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

    @Column(name = "submitted_by", nullable = false, updatable = false)
    private String submittedBy;

    @Column(name = "reviewed_by")
    private String reviewedBy;

    @Column(name = "settled_by")
    private String settledBy;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private LocalDateTime submittedAt;

    @Column(name = "review_started_at")
    private LocalDateTime reviewStartedAt;

    @Column(name = "approved_at")
    private LocalDateTime approvedAt;

    @Column(name = "rejected_at")
    private LocalDateTime rejectedAt;

    @Column(name = "settled_at")
    private LocalDateTime settledAt;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;

    public void assertCanTransitionTo(ClaimStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(status, target);
        }
    }

    public ClaimStatus startReview(String reviewerId, LocalDateTime at) {
        assertCanTransitionTo(ClaimStatus.UNDER_REVIEW);
        ClaimStatus previous = status;
        this.status = ClaimStatus.UNDER_REVIEW;
        this.reviewStartedAt = at;
        this.reviewedBy = reviewerId;
        return previous;
    }

    public ClaimStatus approve(BigDecimal amount, String approverId, LocalDateTime at) {
        assertCanTransitionTo(ClaimStatus.APPROVED);
        if (amount == null) {
            throw new ValidationException("approvedAmount", "Approved amount is required to approve a claim");
        }
        if (amount.signum() <= 0) {
            throw new ValidationException("approvedAmount", "Approved amount must be positive");
        }
        if (amount.compareTo(amountRequested) > 0) {
            throw new ValidationException("approvedAmount",
                    String.format("Approved amount %s exceeds requested amount %s",
                            amount.toPlainString(), amountRequested.toPlainString()));
        }
        ClaimStatus previous = status;
        this.status = ClaimStatus.APPROVED;
        this.amountApproved = amount;
        this.approvedAt = at;
        this.reviewedBy = approverId;
        return previous;
    }

    public ClaimStatus reject(String reason, String reviewerId, LocalDateTime at) {
        assertCanTransitionTo(ClaimStatus.REJECTED);
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("reason", "A rejection reason is required");
        }
        ClaimStatus previous = status;
        this.status = ClaimStatus.REJECTED;
        this.rejectionReason = reason.trim();
        this.rejectedAt = at;
        this.reviewedBy = reviewerId;
        return previous;
    }

    /**
     * Settles for the approved amount unless a lower override is given.
     */
    public ClaimStatus settle(BigDecimal overrideAmount, String settledById, LocalDateTime at) {
        assertCanTransitionTo(ClaimStatus.SETTLED);
        if (amountApproved == null) {
            throw new PreconditionFailedException("Claim " + claimNumber + " has no approved amount to settle");
        }
        BigDecimal settledAmount = amountApproved;
        if (overrideAmount != null) {
            if (overrideAmount.signum() <= 0 || overrideAmount.compareTo(amountApproved) > 0) {
                throw new ValidationException("settledAmount",
                        String.format("Settled amount %s must be positive and not exceed approved amount %s",
                                overrideAmount.toPlainString(), amountApproved.toPlainString()));
            }
            settledAmount = overrideAmount;
        }
        ClaimStatus previous = status;
        this.status = ClaimStatus.SETTLED;
        this.amountSettled = settledAmount;
        this.settledAt = at;
        this.settledBy = settledById;
        return previous;
    }

    public ClaimStatus close(LocalDateTime at) {
        assertCanTransitionTo(ClaimStatus.CLOSED);
        ClaimStatus previous = status;
        this.status = ClaimStatus.CLOSED;
        this.closedAt = at;
        return previous;
    }

    /**
     * Investigation steps that carry no bookkeeping of their own.
     */
    public ClaimStatus advanceTo(ClaimStatus target) {
        assertCanTransitionTo(target);
        if (!PLAIN_TARGETS.contains(target)) {
            throw new IllegalArgumentException("Status " + target + " must be entered through its own operation");
        }
        ClaimStatus previous = status;
        this.status = target;
        return previous;
    }

    /**
     * When processing ended, for SLA purposes; null while the claim is in flight.
     */
    public LocalDateTime resolvedAt() {
        if (settledAt != null) {
            return settledAt;
        }
        if (rejectedAt != null) {
            return rejectedAt;
        }
        return closedAt;
    }

    public enum ClaimType {
        ACCIDENT,
        THEFT,
        NATURAL_DISASTER,
        MEDICAL,
        DEATH,
        DAMAGE,
        LIABILITY,
        OTHER
    }
}
