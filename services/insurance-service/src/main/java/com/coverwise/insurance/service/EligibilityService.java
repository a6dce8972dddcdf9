package com.coverwise.insurance.service;

import com.coverwise.insurance.domain.CustomerContext;
import com.coverwise.insurance.domain.EligibilityResult;
import com.coverwise.insurance.entity.EligibilityRule;
import com.coverwise.insurance.entity.InsuranceApplication;
import com.coverwise.insurance.exception.ResourceNotFoundException;
import com.coverwise.insurance.repository.EligibilityRuleRepository;
import com.coverwise.insurance.repository.InsuranceApplicationRepository;
import com.coverwise.insurance.rules.ConditionEvaluator;
import com.coverwise.insurance.rules.ConditionParser;
import com.coverwise.insurance.rules.InvalidRuleConditionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Checks an application against the eligibility rules of its insurance type.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EligibilityService {

    private final InsuranceApplicationRepository applicationRepository;
    private final EligibilityRuleRepository eligibilityRuleRepository;
    private final CustomerContextLoader customerContextLoader;
    private final ConditionParser conditionParser;
    private final Clock clock;

    @Transactional(readOnly = true)
    public EligibilityResult evaluate(UUID applicationId) {
        InsuranceApplication application = applicationRepository.findById(applicationId)
                .orElseThrow(() -> new ResourceNotFoundException("Application", applicationId));

        CustomerContext customer = customerContextLoader.load(application.getCustomer(), LocalDate.now(clock));
        ConditionEvaluator evaluator = new ConditionEvaluator(customer);

        List<String> failures = new ArrayList<>();
        for (EligibilityRule rule : eligibilityRuleRepository
                .findByInsuranceTypeIdAndActiveTrueOrderByPriorityDesc(application.getInsuranceType().getId())) {
            try {
                if (!evaluator.test(conditionParser.parse(rule.getRuleCondition()))) {
                    failures.add(rule.getErrorMessage());
                }
            } catch (InvalidRuleConditionException e) {
                // a broken rule must not block applications
                log.warn("Eligibility rule '{}' has an invalid condition and was skipped: {}",
                        rule.getRuleName(), e.getMessage());
            }
        }

        log.info("Application {} eligibility: {} rule(s) failed", application.getApplicationNumber(), failures.size());
        return new EligibilityResult(failures);
    }
}
