package com.coverwise.insurance.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ClaimStatus transition table")
class ClaimStatusTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "SUBMITTED, UNDER_REVIEW",
        "UNDER_REVIEW, APPROVED",
        "UNDER_REVIEW, REJECTED",
        "UNDER_REVIEW, SURVEYOR_ASSIGNED",
        "SURVEYOR_ASSIGNED, UNDER_INVESTIGATION",
        "UNDER_INVESTIGATION, ASSESSED",
        "ASSESSED, APPROVED",
        "ASSESSED, REJECTED",
        "APPROVED, SETTLED",
        "SETTLED, CLOSED",
        "REJECTED, CLOSED"
    })
    void shouldAllowListedTransitions(ClaimStatus from, ClaimStatus to) {
        assertThat(from.canTransitionTo(to)).isTrue();
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "SUBMITTED, APPROVED",
        "SUBMITTED, SETTLED",
        "UNDER_REVIEW, SETTLED",
        "SURVEYOR_ASSIGNED, APPROVED",
        "UNDER_INVESTIGATION, APPROVED",
        "APPROVED, REJECTED",
        "APPROVED, CLOSED",
        "REJECTED, SETTLED",
        "REJECTED, APPROVED",
        "SETTLED, APPROVED",
        "CLOSED, SUBMITTED"
    })
    void shouldRejectUnlistedTransitions(ClaimStatus from, ClaimStatus to) {
        assertThat(from.canTransitionTo(to)).isFalse();
    }

    @Test
    void shouldHaveExactlyElevenLegalEdges() {
        long edges = Arrays.stream(ClaimStatus.values())
                .mapToLong(status -> status.allowedTargets().size())
                .sum();

        assertThat(edges).isEqualTo(11);
    }

    @ParameterizedTest
    @EnumSource(ClaimStatus.class)
    void shouldNeverAllowSelfTransition(ClaimStatus status) {
        assertThat(status.canTransitionTo(status)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(ClaimStatus.class)
    void shouldRejectNullTarget(ClaimStatus status) {
        assertThat(status.canTransitionTo(null)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(ClaimStatus.class)
    void shouldNeverReturnToSubmitted(ClaimStatus status) {
        assertThat(status.canTransitionTo(ClaimStatus.SUBMITTED)).isFalse();
    }

    @Test
    void closedShouldBeTheOnlyTerminalStatus() {
        Set<ClaimStatus> terminal = EnumSet.noneOf(ClaimStatus.class);
        for (ClaimStatus status : ClaimStatus.values()) {
            if (status.isTerminal()) {
                terminal.add(status);
            }
        }

        assertThat(terminal).containsExactly(ClaimStatus.CLOSED);
        assertThat(ClaimStatus.CLOSED.allowedTargets()).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(value = ClaimStatus.class, names = {"SETTLED", "REJECTED", "CLOSED"})
    void shouldIdentifyResolvedStatuses(ClaimStatus status) {
        assertThat(status.isResolved()).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = ClaimStatus.class, names = {"SETTLED", "REJECTED", "CLOSED"}, mode = EnumSource.Mode.EXCLUDE)
    void shouldIdentifyInFlightStatuses(ClaimStatus status) {
        assertThat(status.isResolved()).isFalse();
    }

    @Test
    void everyStatusShouldHaveADescription() {
        assertThat(ClaimStatus.values())
                .allSatisfy(status -> assertThat(status.getDescription()).isNotBlank());
    }
}
