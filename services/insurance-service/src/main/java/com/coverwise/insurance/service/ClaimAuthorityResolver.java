package com.coverwise.insurance.service;

import com.coverwise.insurance.domain.ActingUser;
import com.coverwise.insurance.domain.ApprovalRequirement;
import com.coverwise.insurance.entity.Claim;
import com.coverwise.insurance.entity.ClaimApprovalThreshold;
import com.coverwise.insurance.repository.ClaimApprovalThresholdRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Claim Authority Resolver
 *
 * <p>Maps a claim's requested amount to its approval threshold and decides whether a user
 * may approve it. When no active threshold covers the amount, approval requires the
 * highest-privilege role; an unconfigured band never auto-approves.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimAuthorityResolver {

    private final ClaimApprovalThresholdRepository thresholdRepository;

    @Transactional(readOnly = true)
    public ApprovalRequirement resolveThreshold(Claim claim) {
        List<ClaimApprovalThreshold> thresholds = thresholdRepository.findActiveContaining(
                claim.getInsuranceType().getId(), claim.getAmountRequested());

        if (thresholds.isEmpty()) {
            log.warn("No approval threshold covers amount {} for claim {}; requiring highest-privilege approver",
                    claim.getAmountRequested(), claim.getClaimNumber());
            return ApprovalRequirement.failClosed();
        }
        if (thresholds.size() > 1) {
            log.warn("{} approval thresholds overlap at amount {} for claim {}; using the lowest band",
                    thresholds.size(), claim.getAmountRequested(), claim.getClaimNumber());
        }
        return ApprovalRequirement.of(thresholds.get(0));
    }

    @Transactional(readOnly = true)
    public boolean canApprove(ActingUser user, Claim claim) {
        return canApprove(user, resolveThreshold(claim));
    }

    public boolean canApprove(ActingUser user, ApprovalRequirement requirement) {
        return user.roles().stream().anyMatch(role -> role.satisfies(requirement.requiredRole()));
    }
}
