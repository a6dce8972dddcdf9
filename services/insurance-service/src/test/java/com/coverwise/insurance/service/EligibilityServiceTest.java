package com.coverwise.insurance.service;

import com.coverwise.insurance.domain.CustomerContext;
import com.coverwise.insurance.domain.EligibilityResult;
import com.coverwise.insurance.entity.EligibilityRule;
import com.coverwise.insurance.entity.InsuranceApplication;
import com.coverwise.insurance.exception.ResourceNotFoundException;
import com.coverwise.insurance.repository.EligibilityRuleRepository;
import com.coverwise.insurance.repository.InsuranceApplicationRepository;
import com.coverwise.insurance.rules.ConditionParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static com.coverwise.insurance.TestFixtures.APPLICATION_ID;
import static com.coverwise.insurance.TestFixtures.FIXED_CLOCK;
import static com.coverwise.insurance.TestFixtures.MOTOR_TYPE_ID;
import static com.coverwise.insurance.TestFixtures.TODAY;
import static com.coverwise.insurance.TestFixtures.approvedApplication;
import static com.coverwise.insurance.TestFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EligibilityService Unit Tests")
class EligibilityServiceTest {

    @Mock
    private InsuranceApplicationRepository applicationRepository;

    @Mock
    private EligibilityRuleRepository eligibilityRuleRepository;

    @Mock
    private CustomerContextLoader customerContextLoader;

    private EligibilityService eligibilityService;

    private InsuranceApplication application;

    @BeforeEach
    void setUp() {
        eligibilityService = new EligibilityService(applicationRepository, eligibilityRuleRepository,
                customerContextLoader, new ConditionParser(), FIXED_CLOCK);
        application = approvedApplication();
    }

    private static EligibilityRule rule(String name, int priority, String condition, String message) {
        return EligibilityRule.builder()
                .ruleName(name)
                .priority(priority)
                .ruleCondition(json(condition))
                .errorMessage(message)
                .active(true)
                .build();
    }

    private void stubCustomer() {
        when(applicationRepository.findById(APPLICATION_ID)).thenReturn(Optional.of(application));
        // 35 years old, income 1,200,000
        when(customerContextLoader.load(application.getCustomer(), TODAY)).thenReturn(
                new CustomerContext(application.getCustomer(), BigDecimal.ZERO, "LOW", List.of(), List.of(), TODAY));
    }

    @Test
    void shouldCollectMessagesOfFailedRulesInPriorityOrder() {
        stubCustomer();
        when(eligibilityRuleRepository.findByInsuranceTypeIdAndActiveTrueOrderByPriorityDesc(MOTOR_TYPE_ID))
                .thenReturn(List.of(
                        rule("Senior cover", 20, "{\"min_age\": 60}", "Applicant must be at least 60"),
                        rule("Working age", 15, "{\"age_range\": [18, 65]}", "Applicant must be 18 to 65"),
                        rule("High earner", 10, "{\"min_income\": 2000000}", "Income below 2,000,000")));

        EligibilityResult result = eligibilityService.evaluate(APPLICATION_ID);

        assertThat(result.isEligible()).isFalse();
        assertThat(result.failures()).containsExactly("Applicant must be at least 60", "Income below 2,000,000");
    }

    @Test
    void shouldSkipRuleWithInvalidCondition() {
        stubCustomer();
        when(eligibilityRuleRepository.findByInsuranceTypeIdAndActiveTrueOrderByPriorityDesc(MOTOR_TYPE_ID))
                .thenReturn(List.of(rule("Broken", 5, "{\"min_age\": \"adult\"}", "Never shown")));

        EligibilityResult result = eligibilityService.evaluate(APPLICATION_ID);

        assertThat(result.isEligible()).isTrue();
    }

    @Test
    void shouldFailForUnknownApplication() {
        when(applicationRepository.findById(APPLICATION_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> eligibilityService.evaluate(APPLICATION_ID))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
