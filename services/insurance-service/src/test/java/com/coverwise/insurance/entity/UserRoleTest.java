package com.coverwise.insurance.entity;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class UserRoleTest {

    @ParameterizedTest(name = "{0} satisfies {1}: {2}")
    @CsvSource({
        "CLAIMS_OFFICER, CLAIMS_OFFICER, true",
        "CLAIMS_OFFICER, CLAIMS_MANAGER, false",
        "CLAIMS_MANAGER, CLAIMS_OFFICER, true",
        "CLAIMS_MANAGER, CLAIMS_MANAGER, true",
        "CLAIMS_MANAGER, CLAIMS_DIRECTOR, false",
        "CLAIMS_DIRECTOR, CLAIMS_MANAGER, true",
        "CLAIMS_DIRECTOR, ADMIN, false",
        "ADMIN, CLAIMS_DIRECTOR, true",
        "ADMIN, ADMIN, true"
    })
    void shouldFollowApprovalHierarchy(UserRole role, UserRole required, boolean expected) {
        assertThat(role.satisfies(required)).isEqualTo(expected);
    }

    @ParameterizedTest
    @EnumSource(value = UserRole.class, names = {"CUSTOMER", "SURVEYOR"})
    void nonApproversShouldSatisfyNothing(UserRole role) {
        assertThat(role.isApprover()).isFalse();
        for (UserRole required : UserRole.values()) {
            assertThat(role.satisfies(required)).as("%s satisfies %s", role, required).isFalse();
        }
    }

    @ParameterizedTest
    @EnumSource(UserRole.class)
    void nullRequirementShouldNeverBeSatisfied(UserRole role) {
        assertThat(role.satisfies(null)).isFalse();
    }

    @Test
    void adminShouldBeTheHighestPrivilege() {
        assertThat(UserRole.highestPrivilege()).isEqualTo(UserRole.ADMIN);
        for (UserRole role : UserRole.values()) {
            assertThat(UserRole.ADMIN.getApprovalRank()).isGreaterThanOrEqualTo(role.getApprovalRank());
        }
    }
}
