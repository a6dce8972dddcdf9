package com.coverwise.insurance.rules;

import java.math.BigDecimal;
import java.util.List;

/**
 * Typed condition of a discount or eligibility rule.
 *
 * <p>Conditions are parsed from their stored JSON once, by {@link ConditionParser}, and
 * interpreted by a {@link Visitor}. Adding a variant forces every visitor to handle it.</p>
 */
public sealed interface RuleCondition {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitMinFleetSize(MinFleetSize condition);

        R visitMaxClaimRatio(MaxClaimRatio condition);

        R visitMinYearsNoClaim(MinYearsNoClaim condition);

        R visitAgeRange(AgeRange condition);

        R visitMinAge(MinAge condition);

        R visitMaxAge(MaxAge condition);

        R visitMinIncome(MinIncome condition);

        R visitAllOf(AllOf condition);
    }

    /**
     * Customer has at least {@code minimum} active fleets.
     */
    record MinFleetSize(int minimum) implements RuleCondition {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMinFleetSize(this);
        }
    }

    /**
     * Rejection rate of the latest claim year, as a fraction, is at most {@code maximum}.
     */
    record MaxClaimRatio(BigDecimal maximum) implements RuleCondition {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMaxClaimRatio(this);
        }
    }

    record MinYearsNoClaim(int years) implements RuleCondition {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMinYearsNoClaim(this);
        }
    }

    record AgeRange(int minAge, int maxAge) implements RuleCondition {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAgeRange(this);
        }
    }

    record MinAge(int minAge) implements RuleCondition {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMinAge(this);
        }
    }

    record MaxAge(int maxAge) implements RuleCondition {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMaxAge(this);
        }
    }

    record MinIncome(BigDecimal minimum) implements RuleCondition {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMinIncome(this);
        }
    }

    /**
     * Conjunction; empty means always satisfied.
     */
    record AllOf(List<RuleCondition> conditions) implements RuleCondition {
        public AllOf {
            conditions = List.copyOf(conditions);
        }

        public static AllOf empty() {
            return new AllOf(List.of());
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAllOf(this);
        }
    }
}
