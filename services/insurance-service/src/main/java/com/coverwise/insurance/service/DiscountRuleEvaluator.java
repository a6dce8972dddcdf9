package com.coverwise.insurance.service;

import com.coverwise.insurance.domain.AppliedDiscount;
import com.coverwise.insurance.domain.CustomerContext;
import com.coverwise.insurance.domain.DiscountOutcome;
import com.coverwise.insurance.entity.DiscountRule;
import com.coverwise.insurance.rules.ConditionEvaluator;
import com.coverwise.insurance.rules.ConditionParser;
import com.coverwise.insurance.rules.InvalidRuleConditionException;
import com.coverwise.insurance.rules.RuleCondition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Decides which discount rules apply to a subtotal.
 *
 * <p>Rules whose window contains today are evaluated highest priority first. Matching
 * combinable rules add up, each capped at its own maximum. Of the matching
 * non-combinable rules only the largest is considered (the higher-priority one on equal
 * amounts), and it replaces the combinable total only if it is strictly greater.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiscountRuleEvaluator {

    private final ConditionParser conditionParser;

    public DiscountOutcome evaluate(List<DiscountRule> rules, BigDecimal subtotal, CustomerContext customer) {
        ConditionEvaluator evaluator = new ConditionEvaluator(customer);

        List<DiscountRule> candidates = rules.stream()
                .filter(DiscountRule::isActive)
                .filter(rule -> rule.isEffectiveOn(customer.today()))
                .sorted(Comparator.comparingInt(DiscountRule::getPriority).reversed()
                        .thenComparing(DiscountRule::getRuleCode))
                .toList();

        List<AppliedDiscount> combinable = new ArrayList<>();
        BigDecimal combinableTotal = BigDecimal.ZERO;
        AppliedDiscount bestExclusive = null;

        for (DiscountRule rule : candidates) {
            if (!matches(rule, evaluator)) {
                continue;
            }
            AppliedDiscount discount = new AppliedDiscount(
                    rule.getRuleCode(), rule.getRuleName(), discountAmount(rule, subtotal), rule.isCombinable());
            log.debug("Discount rule {} matched for {}", rule.getRuleCode(), discount.amount());

            if (rule.isCombinable()) {
                combinable.add(discount);
                combinableTotal = combinableTotal.add(discount.amount());
            } else if (bestExclusive == null || discount.amount().compareTo(bestExclusive.amount()) > 0) {
                bestExclusive = discount;
            }
        }

        if (bestExclusive != null && bestExclusive.amount().compareTo(combinableTotal) > 0) {
            return new DiscountOutcome(List.of(bestExclusive), bestExclusive.amount());
        }
        return new DiscountOutcome(combinable, combinableTotal);
    }

    private boolean matches(DiscountRule rule, ConditionEvaluator evaluator) {
        RuleCondition condition;
        try {
            condition = conditionParser.parse(rule.getRuleCondition());
        } catch (InvalidRuleConditionException e) {
            log.warn("Discount rule {} has an invalid condition and will not apply: {}", rule.getRuleCode(), e.getMessage());
            return false;
        }
        return evaluator.test(condition);
    }

    private BigDecimal discountAmount(DiscountRule rule, BigDecimal subtotal) {
        BigDecimal amount = PremiumCalculationService.percentOf(subtotal, rule.getDiscountPercentage());
        if (rule.getDiscountMaxAmount() != null && amount.compareTo(rule.getDiscountMaxAmount()) > 0) {
            return rule.getDiscountMaxAmount();
        }
        return amount;
    }
}
