package com.coverwise.insurance.service;

import com.coverwise.insurance.config.InsuranceEngineProperties;
import com.coverwise.insurance.domain.PremiumBreakdown;
import com.coverwise.insurance.domain.QuoteScore;
import com.coverwise.insurance.entity.CoverageType;
import com.coverwise.insurance.entity.CustomerProfile;
import com.coverwise.insurance.entity.InsuranceApplication;
import com.coverwise.insurance.entity.InsuranceCompany;
import com.coverwise.insurance.entity.QuoteScoringWeight;
import com.coverwise.insurance.entity.QuoteScoringWeight.ScoringFactor;
import com.coverwise.insurance.repository.CoverageTypeRepository;
import com.coverwise.insurance.repository.QuoteScoringWeightRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Quote Scoring Engine
 *
 * <pre>
 * overall = 0.40 * affordability + 0.30 * claim ratio + 0.20 * coverage + 0.10 * service rating
 * </pre>
 *
 * Each component is on a 0-100 scale. Scoring is rule based and deterministic: the same
 * inputs always give the same score.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuoteScoringService {

    private final CoverageTypeRepository coverageTypeRepository;
    private final QuoteScoringWeightRepository scoringWeightRepository;
    private final InsuranceEngineProperties properties;

    // Scoring weights
    private static final BigDecimal AFFORDABILITY_WEIGHT = new BigDecimal("0.40");
    private static final BigDecimal CLAIM_RATIO_WEIGHT = new BigDecimal("0.30");
    private static final BigDecimal COVERAGE_WEIGHT = new BigDecimal("0.20");
    private static final BigDecimal SERVICE_RATING_WEIGHT = new BigDecimal("0.10");

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final MathContext PRECISION = MathContext.DECIMAL64;

    @Transactional(readOnly = true)
    public QuoteScore score(PremiumBreakdown breakdown, InsuranceCompany insurer,
                            Collection<UUID> selectedCoverageIds, InsuranceApplication application) {
        UUID insuranceTypeId = application.getInsuranceType().getId();
        CustomerProfile customer = application.getCustomer();

        BigDecimal affordability = affordabilityScore(breakdown.totalPremium(),
                customer != null ? customer.getAnnualIncome() : null,
                application.getBudgetMin(), application.getBudgetMax());
        BigDecimal claimRatio = claimRatioScore(insurer.getClaimSettlementRatio());
        BigDecimal coverage = coverageScore(
                coverageTypeRepository.findByInsuranceTypeIdAndActiveTrue(insuranceTypeId), selectedCoverageIds);
        BigDecimal serviceRating = serviceRatingScore(insurer.getServiceRating());

        Map<ScoringFactor, BigDecimal> weights = weightsFor(insuranceTypeId);
        BigDecimal overall = affordability.multiply(weights.get(ScoringFactor.AFFORDABILITY))
                .add(claimRatio.multiply(weights.get(ScoringFactor.CLAIM_RATIO)))
                .add(coverage.multiply(weights.get(ScoringFactor.COVERAGE)))
                .add(serviceRating.multiply(weights.get(ScoringFactor.SERVICE_RATING)))
                .max(BigDecimal.ZERO)
                .min(HUNDRED);

        QuoteScore score = new QuoteScore(
                round(overall), round(affordability), round(claimRatio), round(coverage), round(serviceRating),
                rationale(round(affordability), round(claimRatio), round(coverage), round(serviceRating),
                        insurer.getCompanyName()));
        log.debug("Scored insurer {}: {}", insurer.getCompanyCode(), score);
        return score;
    }

    /**
     * Budget fit when the customer gave a budget range, otherwise premium as a share of
     * annual income, otherwise neutral.
     */
    BigDecimal affordabilityScore(BigDecimal premium, BigDecimal annualIncome,
                                  BigDecimal budgetMin, BigDecimal budgetMax) {
        if (budgetMin != null && budgetMax != null) {
            if (premium.compareTo(budgetMin) >= 0 && premium.compareTo(budgetMax) <= 0) {
                BigDecimal rangeSize = budgetMax.subtract(budgetMin);
                if (rangeSize.signum() > 0) {
                    BigDecimal position = premium.subtract(budgetMin).divide(rangeSize, PRECISION);
                    return HUNDRED.subtract(position.multiply(BigDecimal.valueOf(20)));
                }
                return BigDecimal.valueOf(90);
            }
            if (premium.compareTo(budgetMin) < 0) {
                // possibly under-covered, not penalized further
                return BigDecimal.valueOf(70);
            }
            if (budgetMax.signum() <= 0) {
                return BigDecimal.valueOf(20);
            }
            BigDecimal overagePct = premium.subtract(budgetMax).divide(budgetMax, PRECISION).multiply(HUNDRED);
            if (overagePct.compareTo(BigDecimal.valueOf(10)) <= 0) {
                return BigDecimal.valueOf(60);
            }
            if (overagePct.compareTo(BigDecimal.valueOf(25)) <= 0) {
                return BigDecimal.valueOf(40);
            }
            return BigDecimal.valueOf(20);
        }

        if (annualIncome != null && annualIncome.signum() > 0) {
            BigDecimal premiumPct = premium.divide(annualIncome, PRECISION).multiply(HUNDRED);
            if (premiumPct.compareTo(BigDecimal.valueOf(3)) <= 0) {
                return BigDecimal.valueOf(100);
            } else if (premiumPct.compareTo(BigDecimal.valueOf(5)) <= 0) {
                return BigDecimal.valueOf(90);
            } else if (premiumPct.compareTo(BigDecimal.valueOf(8)) <= 0) {
                return BigDecimal.valueOf(75);
            } else if (premiumPct.compareTo(BigDecimal.valueOf(12)) <= 0) {
                return BigDecimal.valueOf(55);
            } else if (premiumPct.compareTo(BigDecimal.valueOf(15)) <= 0) {
                return BigDecimal.valueOf(35);
            }
            return BigDecimal.valueOf(15);
        }

        return BigDecimal.valueOf(50);
    }

    BigDecimal claimRatioScore(BigDecimal ratio) {
        if (ratio.compareTo(new BigDecimal("0.95")) >= 0) {
            return BigDecimal.valueOf(100);
        } else if (ratio.compareTo(new BigDecimal("0.92")) >= 0) {
            return BigDecimal.valueOf(90);
        } else if (ratio.compareTo(new BigDecimal("0.90")) >= 0) {
            return BigDecimal.valueOf(85);
        } else if (ratio.compareTo(new BigDecimal("0.85")) >= 0) {
            return BigDecimal.valueOf(70);
        } else if (ratio.compareTo(new BigDecimal("0.80")) >= 0) {
            return BigDecimal.valueOf(55);
        } else if (ratio.compareTo(new BigDecimal("0.75")) >= 0) {
            return BigDecimal.valueOf(40);
        }
        return BigDecimal.valueOf(25);
    }

    /**
     * 60 points for mandatory coverages and 40 for optional ones, each in proportion to
     * how many were selected. A category with no coverages awards its full share.
     */
    BigDecimal coverageScore(List<CoverageType> available, Collection<UUID> selectedIds) {
        int totalMandatory = 0;
        int selectedMandatory = 0;
        int totalOptional = 0;
        int selectedOptional = 0;
        for (CoverageType coverage : available) {
            boolean selected = selectedIds.contains(coverage.getId());
            if (coverage.isMandatory()) {
                totalMandatory++;
                if (selected) {
                    selectedMandatory++;
                }
            } else {
                totalOptional++;
                if (selected) {
                    selectedOptional++;
                }
            }
        }
        return share(selectedMandatory, totalMandatory, BigDecimal.valueOf(60))
                .add(share(selectedOptional, totalOptional, BigDecimal.valueOf(40)));
    }

    BigDecimal serviceRatingScore(BigDecimal rating) {
        return rating.divide(BigDecimal.valueOf(5), PRECISION).multiply(HUNDRED);
    }

    String rationale(BigDecimal affordability, BigDecimal claimRatio, BigDecimal coverage,
                     BigDecimal serviceRating, String companyName) {
        List<String> reasons = new ArrayList<>();

        if (atLeast(affordability, 80)) {
            reasons.add("fits well within your budget");
        } else if (atLeast(affordability, 60)) {
            reasons.add("reasonably priced");
        }

        if (atLeast(claimRatio, 85)) {
            reasons.add(companyName + " has an excellent claim settlement record");
        } else if (atLeast(claimRatio, 70)) {
            reasons.add(companyName + " has a good claim settlement ratio");
        }

        if (atLeast(coverage, 80)) {
            reasons.add("provides comprehensive coverage");
        } else if (atLeast(coverage, 60)) {
            reasons.add("covers all essential needs");
        }

        if (atLeast(serviceRating, 80)) {
            reasons.add("highly rated for customer service");
        }

        if (reasons.isEmpty()) {
            reasons.add("balanced option for your requirements");
        }
        return "This quote " + String.join(", ", reasons) + ".";
    }

    private Map<ScoringFactor, BigDecimal> weightsFor(UUID insuranceTypeId) {
        Map<ScoringFactor, BigDecimal> weights = new EnumMap<>(ScoringFactor.class);
        weights.put(ScoringFactor.AFFORDABILITY, AFFORDABILITY_WEIGHT);
        weights.put(ScoringFactor.CLAIM_RATIO, CLAIM_RATIO_WEIGHT);
        weights.put(ScoringFactor.COVERAGE, COVERAGE_WEIGHT);
        weights.put(ScoringFactor.SERVICE_RATING, SERVICE_RATING_WEIGHT);

        if (properties.getScoring().isUseConfiguredWeights()) {
            for (QuoteScoringWeight weight : scoringWeightRepository.findByInsuranceTypeIdAndActiveTrue(insuranceTypeId)) {
                weights.put(weight.getFactor(), weight.getFactorWeight());
            }
        }
        return weights;
    }

    private static BigDecimal share(int selected, int total, BigDecimal points) {
        if (total == 0) {
            return points;
        }
        return BigDecimal.valueOf(selected).multiply(points).divide(BigDecimal.valueOf(total), PRECISION);
    }

    private static boolean atLeast(BigDecimal score, int threshold) {
        return score.compareTo(BigDecimal.valueOf(threshold)) >= 0;
    }

    private static BigDecimal round(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
