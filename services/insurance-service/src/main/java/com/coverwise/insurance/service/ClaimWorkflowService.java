package com.coverwise.insurance.service;

import com.coverwise.insurance.config.InsuranceEngineProperties;
import com.coverwise.insurance.domain.ActingUser;
import com.coverwise.insurance.domain.ApprovalRequirement;
import com.coverwise.insurance.domain.AssessmentReport;
import com.coverwise.insurance.domain.BankDetails;
import com.coverwise.insurance.domain.ClaimSubmission;
import com.coverwise.insurance.domain.ClaimTransitionResult;
import com.coverwise.insurance.domain.RequestMetadata;
import com.coverwise.insurance.domain.SlaStatus;
import com.coverwise.insurance.entity.Claim;
import com.coverwise.insurance.entity.ClaimAssessment;
import com.coverwise.insurance.entity.ClaimAssessment.AssessmentStatus;
import com.coverwise.insurance.entity.ClaimSettlement;
import com.coverwise.insurance.entity.ClaimSettlement.SettlementMethod;
import com.coverwise.insurance.entity.ClaimSettlement.SettlementStatus;
import com.coverwise.insurance.entity.ClaimStatus;
import com.coverwise.insurance.entity.ClaimStatusHistory;
import com.coverwise.insurance.entity.CustomerProfile;
import com.coverwise.insurance.entity.InsuranceType;
import com.coverwise.insurance.entity.UserRole;
import com.coverwise.insurance.event.ClaimStatusChangedEvent;
import com.coverwise.insurance.exception.InvalidStateException;
import com.coverwise.insurance.exception.InvalidTransitionException;
import com.coverwise.insurance.exception.PreconditionFailedException;
import com.coverwise.insurance.exception.ResourceNotFoundException;
import com.coverwise.insurance.exception.UnauthorizedApprovalException;
import com.coverwise.insurance.exception.ValidationException;
import com.coverwise.insurance.repository.ClaimAssessmentRepository;
import com.coverwise.insurance.repository.ClaimRepository;
import com.coverwise.insurance.repository.ClaimSettlementRepository;
import com.coverwise.insurance.repository.ClaimStatusHistoryRepository;
import com.coverwise.insurance.repository.CustomerProfileRepository;
import com.coverwise.insurance.repository.InsuranceTypeRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Claims Workflow State Machine
 *
 * <p>Every mutating operation locks the claim row, validates the complete change, then
 * mutates the claim and appends exactly one {@link ClaimStatusHistory} row in the same
 * transaction. A rejected operation throws before anything is written.</p>
 *
 * @see ClaimStatus#canTransitionTo(ClaimStatus)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimWorkflowService {

    private final ClaimRepository claimRepository;
    private final ClaimStatusHistoryRepository historyRepository;
    private final ClaimAssessmentRepository assessmentRepository;
    private final ClaimSettlementRepository settlementRepository;
    private final CustomerProfileRepository customerProfileRepository;
    private final InsuranceTypeRepository insuranceTypeRepository;
    private final ClaimAuthorityResolver authorityResolver;
    private final BusinessParameterService businessParameterService;
    private final ReferenceNumberGenerator referenceNumberGenerator;
    private final ApplicationEventPublisher eventPublisher;
    private final InsuranceEngineProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Transactional
    public Claim submitClaim(ClaimSubmission submission, ActingUser actor, RequestMetadata metadata) {
        LocalDateTime now = LocalDateTime.now(clock);

        if (submission.amountRequested() == null || submission.amountRequested().signum() <= 0) {
            throw new ValidationException("amountRequested", "Requested amount must be positive");
        }
        if (submission.claimType() == null) {
            throw new ValidationException("claimType", "Claim type is required");
        }
        if (submission.incidentDate() == null || submission.incidentDate().isAfter(now.toLocalDate())) {
            throw new ValidationException("incidentDate", "Incident date is required and cannot be in the future");
        }

        CustomerProfile customer = customerProfileRepository.findById(submission.customerId())
                .orElseThrow(() -> new ResourceNotFoundException("Customer", submission.customerId()));
        InsuranceType insuranceType = insuranceTypeRepository.findById(submission.insuranceTypeId())
                .orElseThrow(() -> new ResourceNotFoundException("InsuranceType", submission.insuranceTypeId()));

        Claim claim = claimRepository.save(Claim.builder()
                .claimNumber(referenceNumberGenerator.next(properties.getClaims().getClaimNumberPrefix()))
                .policyNumber(submission.policyNumber())
                .customer(customer)
                .insuranceType(insuranceType)
                .claimType(submission.claimType())
                .status(ClaimStatus.SUBMITTED)
                .incidentDate(submission.incidentDate())
                .description(submission.description())
                .amountRequested(submission.amountRequested())
                .submittedBy(actor.userId())
                .submittedAt(now)
                .build());

        recordTransition(claim, null, actor, "Claim submitted", metadata, now);
        log.info("Claim {} submitted by {} for {}", claim.getClaimNumber(), actor.userId(), claim.getAmountRequested());
        return claim;
    }

    /**
     * Moves a claim to {@code newStatus}.
     *
     * @param reason         required when rejecting, recorded in history otherwise
     * @param approvedAmount required when approving; must not exceed the requested amount
     */
    @Transactional
    public ClaimTransitionResult transition(UUID claimId, ClaimStatus newStatus, ActingUser actor, String reason,
                                            BigDecimal approvedAmount, RequestMetadata metadata) {
        return applyTransition(claimId, newStatus, actor, reason, approvedAmount, null, metadata);
    }

    /**
     * Transition to SETTLED paying less than the approved amount.
     */
    @Transactional
    public ClaimTransitionResult settle(UUID claimId, BigDecimal settledAmount, ActingUser actor, String reason,
                                        RequestMetadata metadata) {
        return applyTransition(claimId, ClaimStatus.SETTLED, actor, reason, null, settledAmount, metadata);
    }

    private ClaimTransitionResult applyTransition(UUID claimId, ClaimStatus target, ActingUser actor, String reason,
                                                  BigDecimal approvedAmount, BigDecimal settledAmount,
                                                  RequestMetadata metadata) {
        Claim claim = lockClaim(claimId);
        claim.assertCanTransitionTo(target);
        LocalDateTime now = LocalDateTime.now(clock);

        ClaimStatus previous;
        switch (target) {
            case UNDER_REVIEW -> previous = claim.startReview(actor.userId(), now);
            case APPROVED -> {
                checkApprovalAuthority(claim, actor);
                previous = claim.approve(approvedAmount, actor.userId(), now);
            }
            case REJECTED -> previous = claim.reject(reason, actor.userId(), now);
            case SETTLED -> previous = claim.settle(settledAmount, actor.userId(), now);
            case CLOSED -> previous = claim.close(now);
            case SURVEYOR_ASSIGNED -> throw new PreconditionFailedException(
                    "Claim " + claim.getClaimNumber() + " needs a surveyor; use surveyor assignment instead");
            case UNDER_INVESTIGATION, ASSESSED -> previous = claim.advanceTo(target);
            default -> throw new InvalidTransitionException(claim.getStatus(), target);
        }

        claimRepository.save(claim);
        ClaimStatusHistory history = recordTransition(claim, previous, actor, reason, metadata, now);
        log.info("Claim {} moved {} -> {} by {}", claim.getClaimNumber(), previous, target, actor.userId());
        return new ClaimTransitionResult(claim, history);
    }

    /**
     * Opens a pending assessment for the surveyor and moves the claim to SURVEYOR_ASSIGNED.
     *
     * @param assessmentDate defaults to today
     */
    @Transactional
    public ClaimAssessment assignSurveyor(UUID claimId, ActingUser surveyor, LocalDate assessmentDate,
                                          RequestMetadata metadata) {
        Claim claim = lockClaim(claimId);
        claim.assertCanTransitionTo(ClaimStatus.SURVEYOR_ASSIGNED);
        if (!surveyor.hasRole(UserRole.SURVEYOR)) {
            throw new ValidationException("surveyor", "User " + surveyor.userId() + " is not a surveyor");
        }
        LocalDateTime now = LocalDateTime.now(clock);

        ClaimAssessment assessment = assessmentRepository.save(ClaimAssessment.builder()
                .claim(claim)
                .surveyorId(surveyor.userId())
                .assessmentDate(assessmentDate != null ? assessmentDate : now.toLocalDate())
                .status(AssessmentStatus.PENDING)
                .createdAt(now)
                .build());

        ClaimStatus previous = claim.advanceTo(ClaimStatus.SURVEYOR_ASSIGNED);
        claimRepository.save(claim);
        recordTransition(claim, previous, surveyor, "Surveyor assigned: " + surveyor.displayName(), metadata, now);
        log.info("Surveyor {} assigned to claim {}", surveyor.userId(), claim.getClaimNumber());
        return assessment;
    }

    /**
     * Completes a pending assessment. A claim under investigation moves to ASSESSED.
     *
     * <p>The claim is locked before the assessment is read, and the assessment itself is
     * read under a row lock, so a second report on the same assessment sees it completed.</p>
     */
    @Transactional
    public ClaimAssessment recordAssessment(UUID assessmentId, AssessmentReport report, ActingUser actor,
                                            RequestMetadata metadata) {
        BigDecimal lossAmount = report.lossAmount();
        BigDecimal deductible = report.deductible() != null ? report.deductible() : BigDecimal.ZERO;
        if (lossAmount == null || lossAmount.signum() < 0) {
            throw new ValidationException("lossAmount", "Assessed loss amount is required and cannot be negative");
        }
        if (deductible.signum() < 0 || deductible.compareTo(lossAmount) > 0) {
            throw new ValidationException("deductible", "Deductible must be between zero and the assessed loss amount");
        }

        UUID claimId = assessmentRepository.findClaimIdById(assessmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Assessment", assessmentId));
        Claim claim = lockClaim(claimId);
        ClaimAssessment assessment = assessmentRepository.findByIdForUpdate(assessmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Assessment", assessmentId));
        if (!assessment.isPending()) {
            throw new InvalidStateException("Assessment", assessment.getStatus().name(), AssessmentStatus.PENDING.name());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        assessment.complete(report.damageAssessment(), lossAmount, deductible, report.findings(), now);
        assessmentRepository.save(assessment);

        if (claim.getStatus() == ClaimStatus.UNDER_INVESTIGATION) {
            ClaimStatus previous = claim.advanceTo(ClaimStatus.ASSESSED);
            claimRepository.save(claim);
            recordTransition(claim, previous, actor,
                    "Assessment completed. Net amount: " + assessment.getNetClaimAmount().toPlainString(), metadata, now);
        }
        log.info("Assessment {} completed for claim {} with net amount {}",
                assessment.getId(), claim.getClaimNumber(), assessment.getNetClaimAmount());
        return assessment;
    }

    /**
     * Records a pending payout for an approved claim. The claim stays APPROVED until a
     * separate transition to SETTLED.
     *
     * @param method defaults to bank transfer, which requires complete bank details
     */
    @Transactional
    public ClaimSettlement createSettlement(UUID claimId, ActingUser actor, SettlementMethod method,
                                            BankDetails bankDetails) {
        Claim claim = lockClaim(claimId);
        if (claim.getStatus() != ClaimStatus.APPROVED) {
            throw new InvalidStateException("Claim " + claim.getClaimNumber(),
                    claim.getStatus().name(), ClaimStatus.APPROVED.name());
        }
        if (claim.getAmountApproved() == null) {
            throw new PreconditionFailedException("Claim " + claim.getClaimNumber() + " has no approved amount");
        }
        if (settlementRepository.existsByClaimIdAndStatus(claim.getId(), SettlementStatus.PENDING)) {
            throw new InvalidStateException("Claim " + claim.getClaimNumber() + " already has a pending settlement");
        }

        SettlementMethod settlementMethod = method != null ? method : SettlementMethod.BANK_TRANSFER;
        if (settlementMethod == SettlementMethod.BANK_TRANSFER && (bankDetails == null || !bankDetails.isComplete())) {
            throw new ValidationException("bankDetails",
                    "Bank account number, bank name, IFSC code and account holder name are required for bank transfer");
        }

        ClaimSettlement.ClaimSettlementBuilder builder = ClaimSettlement.builder()
                .claim(claim)
                .settlementAmount(claim.getAmountApproved())
                .settlementMethod(settlementMethod)
                .approvedBy(actor.userId())
                .status(SettlementStatus.PENDING)
                .createdAt(LocalDateTime.now(clock));
        if (bankDetails != null) {
            builder.bankAccountNumber(bankDetails.accountNumber())
                    .bankName(bankDetails.bankName())
                    .ifscCode(bankDetails.ifscCode())
                    .accountHolderName(bankDetails.accountHolderName());
        }

        ClaimSettlement settlement = settlementRepository.save(builder.build());
        log.info("Settlement of {} via {} created for claim {} by {}",
                settlement.getSettlementAmount(), settlementMethod, claim.getClaimNumber(), actor.userId());
        return settlement;
    }

    /**
     * Marks a pending settlement as paid out. Does not transition the claim.
     */
    @Transactional
    public ClaimSettlement completeSettlement(UUID settlementId, String transactionReference) {
        ClaimSettlement settlement = settlementRepository.findByIdForUpdate(settlementId)
                .orElseThrow(() -> new ResourceNotFoundException("Settlement", settlementId));
        settlement.markProcessed(transactionReference, LocalDateTime.now(clock));
        log.info("Settlement {} processed with reference {}", settlementId, transactionReference);
        return settlementRepository.save(settlement);
    }

    /**
     * Audit trail of the claim, oldest change first.
     */
    @Transactional(readOnly = true)
    public List<ClaimStatusHistory> getHistory(UUID claimId) {
        if (!claimRepository.existsById(claimId)) {
            throw new ResourceNotFoundException("Claim", claimId);
        }
        return historyRepository.findByClaimIdOrderByChangedAtAsc(claimId);
    }

    @Transactional(readOnly = true)
    public SlaStatus getSlaStatus(UUID claimId) {
        Claim claim = claimRepository.findById(claimId)
                .orElseThrow(() -> new ResourceNotFoundException("Claim", claimId));
        return slaStatus(claim);
    }

    /**
     * SLA days come from the claim's approval threshold, or the CLAIM_SLA_DAYS parameter
     * when no threshold covers the amount. Days are whole calendar days.
     */
    SlaStatus slaStatus(Claim claim) {
        ApprovalRequirement requirement = authorityResolver.resolveThreshold(claim);
        int slaDays = requirement.isFallback()
                ? businessParameterService.currentParameters().claimSlaDays()
                : requirement.threshold().getMaxProcessingDays();
        LocalDate submitted = claim.getSubmittedAt().toLocalDate();

        if (claim.getStatus().isResolved()) {
            LocalDateTime resolvedAt = claim.resolvedAt();
            long processingDays = resolvedAt != null ? ChronoUnit.DAYS.between(submitted, resolvedAt.toLocalDate()) : 0;
            return new SlaStatus(SlaStatus.State.COMPLETED, slaDays, processingDays, null, processingDays <= slaDays);
        }

        long elapsed = ChronoUnit.DAYS.between(submitted, LocalDate.now(clock));
        long remaining = slaDays - elapsed;
        return new SlaStatus(SlaStatus.State.IN_PROGRESS, slaDays, elapsed, Math.max(0, remaining), remaining >= 0);
    }

    private void checkApprovalAuthority(Claim claim, ActingUser actor) {
        ApprovalRequirement requirement = authorityResolver.resolveThreshold(claim);
        if (!authorityResolver.canApprove(actor, requirement)) {
            getApprovalsDeniedCounter().increment();
            log.warn("User {} with roles {} denied approval of claim {}; {} required",
                    actor.userId(), actor.roles(), claim.getClaimNumber(), requirement.requiredRole());
            throw new UnauthorizedApprovalException(actor.userId(), requirement.requiredRole());
        }
    }

    private Claim lockClaim(UUID claimId) {
        return claimRepository.findByIdForUpdate(claimId)
                .orElseThrow(() -> new ResourceNotFoundException("Claim", claimId));
    }

    private ClaimStatusHistory recordTransition(Claim claim, ClaimStatus oldStatus, ActingUser actor, String reason,
                                                RequestMetadata metadata, LocalDateTime at) {
        RequestMetadata request = metadata != null ? metadata : RequestMetadata.none();
        ClaimStatusHistory history = historyRepository.save(ClaimStatusHistory.builder()
                .claimId(claim.getId())
                .oldStatus(oldStatus)
                .newStatus(claim.getStatus())
                .changedBy(actor.userId())
                .reason(reason)
                .ipAddress(RequestMetadata.truncate(request.ipAddress(), RequestMetadata.MAX_IP_ADDRESS_LENGTH))
                .userAgent(RequestMetadata.truncate(request.userAgent(), properties.getClaims().getUserAgentMaxLength()))
                .changedAt(at)
                .build());

        publishAfterCommit(new ClaimStatusChangedEvent(
                claim.getId(), claim.getClaimNumber(), oldStatus, claim.getStatus(), actor.userId(), at));
        getTransitionCounter(claim.getStatus()).increment();
        return history;
    }

    /**
     * Listeners only hear about transitions that committed. Outside a transaction the
     * event goes out immediately.
     */
    private void publishAfterCommit(ClaimStatusChangedEvent event) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            eventPublisher.publishEvent(event);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                eventPublisher.publishEvent(event);
            }
        });
    }

    private Counter getTransitionCounter(ClaimStatus status) {
        return Counter.builder("insurance_claim_transitions_total")
                .description("Total number of claim status changes")
                .tag("service", "insurance-service")
                .tag("status", status.name())
                .register(meterRegistry);
    }

    private Counter getApprovalsDeniedCounter() {
        return Counter.builder("insurance_claim_approvals_denied_total")
                .description("Total number of claim approvals refused for insufficient authority")
                .tag("service", "insurance-service")
                .register(meterRegistry);
    }
}
