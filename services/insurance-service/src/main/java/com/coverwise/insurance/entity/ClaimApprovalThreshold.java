package com.coverwise.insurance.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Claim amount band mapped to the approver role it requires and its processing SLA.
 * Active bands of one insurance type are contiguous and never overlap.
 */
@Entity
@Table(name = "claim_approval_thresholds", indexes = {
    @Index(name = "idx_threshold_type_range", columnList = "insurance_type_id, min_amount, max_amount")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimApprovalThreshold {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "insurance_type_id", nullable = false)
    private InsuranceType insuranceType;

    @Enumerated(EnumType.STRING)
    @Column(name = "approval_level", nullable = false, length = 30)
    private ApprovalLevel approvalLevel;

    @Column(name = "min_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal minAmount;

    @Column(name = "max_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal maxAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "required_approver_role", nullable = false, length = 30)
    private UserRole requiredApproverRole;

    @Builder.Default
    @Column(name = "max_processing_days", nullable = false)
    private int maxProcessingDays = 15;

    @Column(name = "active", nullable = false)
    private boolean active;

    public enum ApprovalLevel {
        AUTO_APPROVE,
        OFFICER_APPROVAL,
        MANAGER_APPROVAL,
        DIRECTOR_APPROVAL
    }
}
