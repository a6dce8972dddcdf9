package com.coverwise.insurance.service;

import com.coverwise.insurance.domain.AppliedDiscount;
import com.coverwise.insurance.domain.CustomerContext;
import com.coverwise.insurance.domain.DiscountOutcome;
import com.coverwise.insurance.entity.DiscountRule;
import com.coverwise.insurance.entity.Fleet;
import com.coverwise.insurance.rules.ConditionParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.coverwise.insurance.TestFixtures.TODAY;
import static com.coverwise.insurance.TestFixtures.customer;
import static com.coverwise.insurance.TestFixtures.customerContext;
import static com.coverwise.insurance.TestFixtures.discountRule;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DiscountRuleEvaluator")
class DiscountRuleEvaluatorTest {

    private static final BigDecimal SUBTOTAL = new BigDecimal("6000");

    private final DiscountRuleEvaluator evaluator = new DiscountRuleEvaluator(new ConditionParser());

    @Nested
    @DisplayName("Combinable versus non-combinable")
    class CombinationTests {

        @Test
        void shouldKeepCombinableSumOnTie() {
            List<DiscountRule> rules = List.of(
                    discountRule("FLEET_LARGE", "15", false, 100, null),
                    discountRule("EARLY_BIRD", "5", true, 50, null),
                    discountRule("NO_CLAIM", "10", true, 40, null));

            DiscountOutcome outcome = evaluator.evaluate(rules, SUBTOTAL, customerContext());

            assertThat(outcome.totalDiscount()).isEqualByComparingTo("900");
            assertThat(outcome.applied()).extracting(AppliedDiscount::ruleCode)
                    .containsExactly("EARLY_BIRD", "NO_CLAIM");
        }

        @Test
        void shouldUseNonCombinableWhenStrictlyGreater() {
            List<DiscountRule> rules = List.of(
                    discountRule("FLEET_LARGE", "16", false, 100, null),
                    discountRule("EARLY_BIRD", "5", true, 50, null),
                    discountRule("NO_CLAIM", "10", true, 40, null));

            DiscountOutcome outcome = evaluator.evaluate(rules, SUBTOTAL, customerContext());

            assertThat(outcome.totalDiscount()).isEqualByComparingTo("960");
            assertThat(outcome.applied()).singleElement()
                    .satisfies(d -> {
                        assertThat(d.ruleCode()).isEqualTo("FLEET_LARGE");
                        assertThat(d.combinable()).isFalse();
                    });
        }

        @Test
        void shouldPickLargestNonCombinableAndHigherPriorityOnEqualAmounts() {
            List<DiscountRule> rules = List.of(
                    discountRule("LOYALTY", "8", false, 10, null),
                    discountRule("CORPORATE", "12", false, 20, null),
                    discountRule("PARTNER", "12", false, 30, null));

            DiscountOutcome outcome = evaluator.evaluate(rules, SUBTOTAL, customerContext());

            assertThat(outcome.applied()).extracting(AppliedDiscount::ruleCode).containsExactly("PARTNER");
            assertThat(outcome.totalDiscount()).isEqualByComparingTo("720");
        }

        @Test
        void shouldReturnNothingWithoutRules() {
            DiscountOutcome outcome = evaluator.evaluate(List.of(), SUBTOTAL, customerContext());

            assertThat(outcome.applied()).isEmpty();
            assertThat(outcome.totalDiscount()).isEqualByComparingTo("0");
        }
    }

    @Nested
    @DisplayName("Rule filtering")
    class FilteringTests {

        @Test
        void shouldCapEachDiscountAtItsMaximum() {
            DiscountRule capped = discountRule("EARLY_BIRD", "10", true, 50, null);
            capped.setDiscountMaxAmount(new BigDecimal("250"));

            DiscountOutcome outcome = evaluator.evaluate(
                    List.of(capped, discountRule("ONLINE", "2", true, 10, null)), SUBTOTAL, customerContext());

            assertThat(outcome.applied()).extracting(AppliedDiscount::amount)
                    .usingComparatorForType(BigDecimal::compareTo, BigDecimal.class)
                    .containsExactly(new BigDecimal("250"), new BigDecimal("120"));
            assertThat(outcome.totalDiscount()).isEqualByComparingTo("370");
        }

        @Test
        void shouldSkipInactiveAndOutOfWindowRules() {
            DiscountRule inactive = discountRule("INACTIVE", "10", true, 50, null);
            inactive.setActive(false);
            DiscountRule future = discountRule("FUTURE", "10", true, 50, null);
            future.setEffectiveFrom(TODAY.plusDays(1));
            DiscountRule expired = discountRule("EXPIRED", "10", true, 50, null);
            expired.setEffectiveTo(TODAY.minusDays(1));
            DiscountRule lastDay = discountRule("LAST_DAY", "5", true, 50, null);
            lastDay.setEffectiveFrom(TODAY.minusDays(30));
            lastDay.setEffectiveTo(TODAY);

            DiscountOutcome outcome = evaluator.evaluate(
                    List.of(inactive, future, expired, lastDay), SUBTOTAL, customerContext());

            assertThat(outcome.applied()).extracting(AppliedDiscount::ruleCode).containsExactly("LAST_DAY");
        }

        @Test
        void shouldApplyOnlyRulesWhoseConditionMatches() {
            CustomerContext fleetOwner = new CustomerContext(customer(), BigDecimal.ZERO, "LOW",
                    List.of(Fleet.builder().fleetName("A").vehicleCount(4).active(true).build(),
                            Fleet.builder().fleetName("B").vehicleCount(6).active(true).build()),
                    List.of(), TODAY);
            List<DiscountRule> rules = List.of(
                    discountRule("FLEET_SMALL", "5", true, 20, "{\"min_fleet_size\": 2}"),
                    discountRule("FLEET_LARGE", "15", false, 30, "{\"min_fleet_size\": 5}"));

            DiscountOutcome outcome = evaluator.evaluate(rules, SUBTOTAL, fleetOwner);

            assertThat(outcome.applied()).extracting(AppliedDiscount::ruleCode).containsExactly("FLEET_SMALL");
            assertThat(outcome.totalDiscount()).isEqualByComparingTo("300");
        }

        @Test
        void shouldTreatMalformedConditionAsNoMatch() {
            List<DiscountRule> rules = List.of(
                    discountRule("BROKEN", "50", true, 90, "{\"min_fleet_size\": \"lots\"}"),
                    discountRule("ONLINE", "2", true, 10, null));

            DiscountOutcome outcome = evaluator.evaluate(rules, SUBTOTAL, customerContext());

            assertThat(outcome.applied()).extracting(AppliedDiscount::ruleCode).containsExactly("ONLINE");
        }
    }
}
