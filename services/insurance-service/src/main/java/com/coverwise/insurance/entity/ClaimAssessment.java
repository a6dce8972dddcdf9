package com.coverwise.insurance.entity;

import com.coverwise.insurance.exception.InvalidStateException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "claim_assessments", indexes = {
    @Index(name = "idx_assessment_claim", columnList = "claim_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClaimAssessment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "claim_id", nullable = false, updatable = false)
    private Claim claim;

    @Column(name = "surveyor_id", nullable = false, updatable = false)
    private String surveyorId;

    @Column(name = "assessment_date", nullable = false)
    private LocalDate assessmentDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AssessmentStatus status;

    @Column(name = "damage_assessment", columnDefinition = "TEXT")
    private String damageAssessment;

    @Column(name = "loss_amount_assessed", precision = 19, scale = 4)
    private BigDecimal lossAmountAssessed;

    @Column(name = "deductible_applicable", precision = 19, scale = 4)
    private BigDecimal deductibleApplicable;

    @Column(name = "net_claim_amount", precision = 19, scale = 4)
    private BigDecimal netClaimAmount;

    @Builder.Default
    @Convert(converter = FindingsConverter.class)
    @Column(name = "findings", columnDefinition = "TEXT")
    private Map<String, Object> findings = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    /**
     * Amounts are validated by the caller; this only guards the assessment's own status.
     */
    public void complete(String damageAssessment, BigDecimal lossAmount, BigDecimal deductible,
                         Map<String, Object> findings, LocalDateTime at) {
        if (status != AssessmentStatus.PENDING) {
            throw new InvalidStateException("Assessment", status.name(), AssessmentStatus.PENDING.name());
        }
        this.damageAssessment = damageAssessment;
        this.lossAmountAssessed = lossAmount;
        this.deductibleApplicable = deductible;
        this.netClaimAmount = lossAmount.subtract(deductible);
        this.findings = findings != null ? new LinkedHashMap<>(findings) : new LinkedHashMap<>();
        this.status = AssessmentStatus.COMPLETED;
        this.completedAt = at;
    }

    public boolean isPending() {
        return status == AssessmentStatus.PENDING;
    }

    public enum AssessmentStatus {
        PENDING,
        COMPLETED
    }
}
