package com.coverwise.insurance.service;

import com.coverwise.insurance.config.InsuranceEngineProperties;
import com.coverwise.insurance.domain.PremiumBreakdown;
import com.coverwise.insurance.domain.QuoteScore;
import com.coverwise.insurance.entity.CoverageType;
import com.coverwise.insurance.entity.InsuranceApplication;
import com.coverwise.insurance.entity.InsuranceCompany;
import com.coverwise.insurance.entity.QuoteScoringWeight;
import com.coverwise.insurance.entity.QuoteScoringWeight.ScoringFactor;
import com.coverwise.insurance.repository.CoverageTypeRepository;
import com.coverwise.insurance.repository.QuoteScoringWeightRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.coverwise.insurance.TestFixtures.MOTOR_TYPE_ID;
import static com.coverwise.insurance.TestFixtures.approvedApplication;
import static com.coverwise.insurance.TestFixtures.coverage;
import static com.coverwise.insurance.TestFixtures.insurer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("QuoteScoringService Unit Tests")
class QuoteScoringServiceTest {

    @Mock
    private CoverageTypeRepository coverageTypeRepository;

    @Mock
    private QuoteScoringWeightRepository scoringWeightRepository;

    private InsuranceEngineProperties properties;

    private QuoteScoringService quoteScoringService;

    private final List<CoverageType> motorCoverages = List.of(
            coverage("OWN_DAMAGE", true, "1200"),
            coverage("THIRD_PARTY", true, "800"),
            coverage("PERSONAL_ACCIDENT", false, "300"),
            coverage("ENGINE_PROTECT", false, "450"));

    @BeforeEach
    void setUp() {
        properties = new InsuranceEngineProperties();
        quoteScoringService = new QuoteScoringService(coverageTypeRepository, scoringWeightRepository, properties);
    }

    static PremiumBreakdown breakdownWithTotal(String total) {
        BigDecimal amount = new BigDecimal(total);
        return new PremiumBreakdown(new BigDecimal("300000"), "100K-500K", amount, List.of(), BigDecimal.ZERO,
                List.of(), BigDecimal.ZERO, amount, BigDecimal.ZERO, "LOW", BigDecimal.ZERO, List.of(),
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, amount, BigDecimal.ZERO, BigDecimal.ZERO, amount);
    }

    private Set<UUID> idsOf(List<CoverageType> coverages) {
        return coverages.stream().map(CoverageType::getId).collect(Collectors.toSet());
    }

    @Test
    void shouldScoreTopInsurerAtBudgetMidpoint() {
        InsuranceApplication application = approvedApplication();
        application.setBudgetMin(new BigDecimal("6000"));
        application.setBudgetMax(new BigDecimal("8000"));
        when(coverageTypeRepository.findByInsuranceTypeIdAndActiveTrue(MOTOR_TYPE_ID)).thenReturn(motorCoverages);

        QuoteScore score = quoteScoringService.score(breakdownWithTotal("7000"), insurer("ACME", "0.97", "4.8"),
                idsOf(motorCoverages), application);

        assertThat(score.affordability()).isEqualByComparingTo("90");
        assertThat(score.claimRatio()).isEqualByComparingTo("100");
        assertThat(score.coverage()).isEqualByComparingTo("100");
        assertThat(score.serviceRating()).isEqualByComparingTo("96");
        assertThat(score.overall()).isEqualTo(new BigDecimal("95.60"));
        verify(scoringWeightRepository, never()).findByInsuranceTypeIdAndActiveTrue(MOTOR_TYPE_ID);
    }

    @Test
    void shouldBeDeterministic() {
        InsuranceApplication application = approvedApplication();
        when(coverageTypeRepository.findByInsuranceTypeIdAndActiveTrue(MOTOR_TYPE_ID)).thenReturn(motorCoverages);
        InsuranceCompany insurer = insurer("ACME", "0.91", "3.9");

        QuoteScore first = quoteScoringService.score(breakdownWithTotal("7198"), insurer, Set.of(), application);
        QuoteScore second = quoteScoringService.score(breakdownWithTotal("7198"), insurer, Set.of(), application);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void shouldUseConfiguredWeightsWhenEnabled() {
        properties.getScoring().setUseConfiguredWeights(true);
        InsuranceApplication application = approvedApplication();
        application.getCustomer().setAnnualIncome(null);
        when(coverageTypeRepository.findByInsuranceTypeIdAndActiveTrue(MOTOR_TYPE_ID)).thenReturn(List.of());
        when(scoringWeightRepository.findByInsuranceTypeIdAndActiveTrue(MOTOR_TYPE_ID)).thenReturn(List.of(
                weight(ScoringFactor.AFFORDABILITY, "1.00"),
                weight(ScoringFactor.CLAIM_RATIO, "0"),
                weight(ScoringFactor.COVERAGE, "0"),
                weight(ScoringFactor.SERVICE_RATING, "0")));

        QuoteScore score = quoteScoringService.score(breakdownWithTotal("7198"), insurer("ACME", "0.97", "4.8"),
                Set.of(), application);

        assertThat(score.overall()).isEqualByComparingTo("50");
    }

    private static QuoteScoringWeight weight(ScoringFactor factor, String value) {
        return QuoteScoringWeight.builder().factor(factor).factorWeight(new BigDecimal(value)).active(true).build();
    }

    @Nested
    @DisplayName("Affordability")
    class AffordabilityTests {

        @ParameterizedTest(name = "premium {0} in [6000, 8000] -> {1}")
        @CsvSource({
            "6000, 100",
            "8000, 80",
            "5000, 70",
            "8800, 60",
            "10000, 40",
            "10001, 20"
        })
        void shouldScoreAgainstBudgetRange(String premium, String expected) {
            assertThat(quoteScoringService.affordabilityScore(new BigDecimal(premium), null,
                    new BigDecimal("6000"), new BigDecimal("8000"))).isEqualByComparingTo(expected);
        }

        @Test
        void shouldScoreDegenerateRangeAtNinety() {
            assertThat(quoteScoringService.affordabilityScore(new BigDecimal("7000"), null,
                    new BigDecimal("7000"), new BigDecimal("7000"))).isEqualByComparingTo("90");
        }

        @ParameterizedTest(name = "premium {0} on income 100000 -> {1}")
        @CsvSource({
            "3000, 100",
            "5000, 90",
            "8000, 75",
            "12000, 55",
            "15000, 35",
            "15001, 15"
        })
        void shouldScoreAgainstIncome(String premium, String expected) {
            assertThat(quoteScoringService.affordabilityScore(new BigDecimal(premium), new BigDecimal("100000"),
                    null, null)).isEqualByComparingTo(expected);
        }

        @Test
        void shouldBeNeutralWithoutBudgetOrIncome() {
            assertThat(quoteScoringService.affordabilityScore(new BigDecimal("7000"), null, null, null))
                    .isEqualByComparingTo("50");
            assertThat(quoteScoringService.affordabilityScore(new BigDecimal("7000"), BigDecimal.ZERO,
                    new BigDecimal("6000"), null)).isEqualByComparingTo("50");
        }
    }

    @ParameterizedTest(name = "ratio {0} -> {1}")
    @CsvSource({
        "0.99, 100",
        "0.95, 100",
        "0.94, 90",
        "0.90, 85",
        "0.89, 70",
        "0.80, 55",
        "0.75, 40",
        "0.60, 25"
    })
    void shouldBandClaimSettlementRatio(String ratio, String expected) {
        assertThat(quoteScoringService.claimRatioScore(new BigDecimal(ratio))).isEqualByComparingTo(expected);
    }

    @Nested
    @DisplayName("Coverage")
    class CoverageTests {

        @Test
        void shouldWeightMandatoryAndOptionalSeparately() {
            Set<UUID> selected = idsOf(List.of(motorCoverages.get(0), motorCoverages.get(1), motorCoverages.get(2)));

            assertThat(quoteScoringService.coverageScore(motorCoverages, selected)).isEqualByComparingTo("80");
        }

        @Test
        void shouldScoreZeroWhenNothingSelected() {
            assertThat(quoteScoringService.coverageScore(motorCoverages, Set.of())).isEqualByComparingTo("0");
        }

        @Test
        void shouldAwardFullShareForEmptyCategory() {
            List<CoverageType> mandatoryOnly = List.of(motorCoverages.get(0), motorCoverages.get(1));

            assertThat(quoteScoringService.coverageScore(mandatoryOnly, idsOf(mandatoryOnly)))
                    .isEqualByComparingTo("100");
            assertThat(quoteScoringService.coverageScore(List.of(), Set.of())).isEqualByComparingTo("100");
        }
    }

    @Nested
    @DisplayName("Rationale")
    class RationaleTests {

        @Test
        void shouldListStrengths() {
            String rationale = quoteScoringService.rationale(new BigDecimal("90"), new BigDecimal("100"),
                    new BigDecimal("100"), new BigDecimal("96"), "ACME General");

            assertThat(rationale).isEqualTo("This quote fits well within your budget, "
                    + "ACME General has an excellent claim settlement record, provides comprehensive coverage, "
                    + "highly rated for customer service.");
        }

        @Test
        void shouldUseMiddleTierPhrases() {
            String rationale = quoteScoringService.rationale(new BigDecimal("60"), new BigDecimal("70"),
                    new BigDecimal("60"), new BigDecimal("70"), "ACME General");

            assertThat(rationale).isEqualTo("This quote reasonably priced, ACME General has a good claim "
                    + "settlement ratio, covers all essential needs.");
        }

        @Test
        void shouldFallBackToBalancedOption() {
            String rationale = quoteScoringService.rationale(new BigDecimal("20"), new BigDecimal("25"),
                    new BigDecimal("0"), new BigDecimal("40"), "ACME General");

            assertThat(rationale).isEqualTo("This quote balanced option for your requirements.");
        }
    }
}
