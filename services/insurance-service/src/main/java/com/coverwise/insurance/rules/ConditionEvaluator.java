package com.coverwise.insurance.rules;

import com.coverwise.insurance.domain.CustomerContext;
import com.coverwise.insurance.entity.CustomerClaimHistory;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Evaluates a {@link RuleCondition} against one customer.
 *
 * <p>Missing customer data never fails a condition: an unknown age passes age bounds,
 * no claim history passes the claim-ratio bound, and an unknown income passes the
 * income floor.</p>
 */
public class ConditionEvaluator implements RuleCondition.Visitor<Boolean> {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final CustomerContext context;

    public ConditionEvaluator(CustomerContext context) {
        this.context = context;
    }

    public boolean test(RuleCondition condition) {
        return condition.accept(this);
    }

    @Override
    public Boolean visitMinFleetSize(RuleCondition.MinFleetSize condition) {
        return context.activeFleets().size() >= condition.minimum();
    }

    @Override
    public Boolean visitMaxClaimRatio(RuleCondition.MaxClaimRatio condition) {
        Optional<CustomerClaimHistory> latest = context.latestClaimHistory();
        if (latest.isEmpty()) {
            return true;
        }
        BigDecimal ratio = latest.get().getClaimRejectionRate().divide(HUNDRED);
        return ratio.compareTo(condition.maximum()) <= 0;
    }

    @Override
    public Boolean visitMinYearsNoClaim(RuleCondition.MinYearsNoClaim condition) {
        int cutoffYear = context.today().getYear() - condition.years();
        return context.claimHistories().stream()
                .noneMatch(h -> h.getClaimYear() >= cutoffYear && h.getClaimCount() > 0);
    }

    @Override
    public Boolean visitAgeRange(RuleCondition.AgeRange condition) {
        Integer age = context.age();
        return age == null || (age >= condition.minAge() && age <= condition.maxAge());
    }

    @Override
    public Boolean visitMinAge(RuleCondition.MinAge condition) {
        Integer age = context.age();
        return age == null || age >= condition.minAge();
    }

    @Override
    public Boolean visitMaxAge(RuleCondition.MaxAge condition) {
        Integer age = context.age();
        return age == null || age <= condition.maxAge();
    }

    @Override
    public Boolean visitMinIncome(RuleCondition.MinIncome condition) {
        BigDecimal income = context.annualIncome();
        return income == null || income.compareTo(condition.minimum()) >= 0;
    }

    @Override
    public Boolean visitAllOf(RuleCondition.AllOf condition) {
        for (RuleCondition child : condition.conditions()) {
            if (!child.accept(this)) {
                return false;
            }
        }
        return true;
    }
}
