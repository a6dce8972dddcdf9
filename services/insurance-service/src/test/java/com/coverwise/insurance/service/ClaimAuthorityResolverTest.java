package com.coverwise.insurance.service;

import com.coverwise.insurance.domain.ActingUser;
import com.coverwise.insurance.domain.ApprovalRequirement;
import com.coverwise.insurance.entity.Claim;
import com.coverwise.insurance.entity.ClaimApprovalThreshold;
import com.coverwise.insurance.entity.ClaimApprovalThreshold.ApprovalLevel;
import com.coverwise.insurance.entity.ClaimStatus;
import com.coverwise.insurance.entity.UserRole;
import com.coverwise.insurance.repository.ClaimApprovalThresholdRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static com.coverwise.insurance.TestFixtures.MOTOR_TYPE_ID;
import static com.coverwise.insurance.TestFixtures.claim;
import static com.coverwise.insurance.TestFixtures.threshold;
import static com.coverwise.insurance.TestFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClaimAuthorityResolver Unit Tests")
class ClaimAuthorityResolverTest {

    @Mock
    private ClaimApprovalThresholdRepository thresholdRepository;

    @InjectMocks
    private ClaimAuthorityResolver claimAuthorityResolver;

    private final ClaimApprovalThreshold managerTier =
            threshold("10001", "100000", UserRole.CLAIMS_MANAGER, ApprovalLevel.MANAGER_APPROVAL);

    @Test
    void shouldResolveMatchingThreshold() {
        Claim claim = claim(ClaimStatus.UNDER_REVIEW, "50000").build();
        when(thresholdRepository.findActiveContaining(MOTOR_TYPE_ID, new BigDecimal("50000")))
                .thenReturn(List.of(managerTier));

        ApprovalRequirement requirement = claimAuthorityResolver.resolveThreshold(claim);

        assertThat(requirement.isFallback()).isFalse();
        assertThat(requirement.threshold()).isSameAs(managerTier);
        assertThat(requirement.requiredRole()).isEqualTo(UserRole.CLAIMS_MANAGER);
    }

    @Test
    void shouldUseLowestBandWhenThresholdsOverlap() {
        ClaimApprovalThreshold directorTier =
                threshold("40000", "500000", UserRole.CLAIMS_DIRECTOR, ApprovalLevel.DIRECTOR_APPROVAL);
        Claim claim = claim(ClaimStatus.UNDER_REVIEW, "50000").build();
        when(thresholdRepository.findActiveContaining(MOTOR_TYPE_ID, new BigDecimal("50000")))
                .thenReturn(List.of(managerTier, directorTier));

        assertThat(claimAuthorityResolver.resolveThreshold(claim).requiredRole()).isEqualTo(UserRole.CLAIMS_MANAGER);
    }

    @Test
    void shouldFailClosedWithoutThreshold() {
        Claim claim = claim(ClaimStatus.UNDER_REVIEW, "10000.50").build();
        when(thresholdRepository.findActiveContaining(MOTOR_TYPE_ID, new BigDecimal("10000.50")))
                .thenReturn(List.of());

        ApprovalRequirement requirement = claimAuthorityResolver.resolveThreshold(claim);

        assertThat(requirement.isFallback()).isTrue();
        assertThat(requirement.requiredRole()).isEqualTo(UserRole.ADMIN);
        assertThat(claimAuthorityResolver.canApprove(user("director-1", UserRole.CLAIMS_DIRECTOR), requirement))
                .isFalse();
        assertThat(claimAuthorityResolver.canApprove(user("admin-1", UserRole.ADMIN), requirement)).isTrue();
    }

    @Test
    void shouldAcceptAnyQualifyingRole() {
        Claim claim = claim(ClaimStatus.UNDER_REVIEW, "50000").build();
        when(thresholdRepository.findActiveContaining(MOTOR_TYPE_ID, new BigDecimal("50000")))
                .thenReturn(List.of(managerTier));
        ActingUser multiRole = user("ops-1", UserRole.SURVEYOR, UserRole.CLAIMS_DIRECTOR);

        assertThat(claimAuthorityResolver.canApprove(multiRole, claim)).isTrue();
    }

    @Test
    void shouldDenyUsersWithoutApproverRoles() {
        ApprovalRequirement requirement = ApprovalRequirement.of(
                threshold("0", "10000", UserRole.CLAIMS_OFFICER, ApprovalLevel.AUTO_APPROVE));

        assertThat(claimAuthorityResolver.canApprove(user("customer-1", UserRole.CUSTOMER), requirement)).isFalse();
        assertThat(claimAuthorityResolver.canApprove(user("nobody"), requirement)).isFalse();
        assertThat(claimAuthorityResolver.canApprove(user("officer-1", UserRole.CLAIMS_OFFICER), requirement)).isTrue();
    }
}
