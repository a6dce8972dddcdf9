package com.coverwise.insurance.service;

import com.coverwise.insurance.config.InsuranceEngineProperties;
import com.coverwise.insurance.domain.ActingUser;
import com.coverwise.insurance.domain.AppliedDiscount;
import com.coverwise.insurance.domain.BusinessParameters;
import com.coverwise.insurance.domain.CustomerContext;
import com.coverwise.insurance.domain.PremiumBreakdown;
import com.coverwise.insurance.domain.PremiumLine;
import com.coverwise.insurance.domain.PremiumRequest;
import com.coverwise.insurance.domain.QuoteGenerationResult;
import com.coverwise.insurance.domain.QuoteScore;
import com.coverwise.insurance.entity.CoverageType;
import com.coverwise.insurance.entity.InsuranceApplication;
import com.coverwise.insurance.entity.InsuranceApplication.ApplicationStatus;
import com.coverwise.insurance.entity.InsuranceCompany;
import com.coverwise.insurance.entity.Quote;
import com.coverwise.insurance.entity.Quote.QuoteStatus;
import com.coverwise.insurance.entity.QuoteDiscountLine;
import com.coverwise.insurance.entity.QuoteLineItem;
import com.coverwise.insurance.entity.QuoteLineItem.ItemType;
import com.coverwise.insurance.entity.QuoteRecommendation;
import com.coverwise.insurance.entity.RiderAddon;
import com.coverwise.insurance.exception.InvalidStateException;
import com.coverwise.insurance.exception.PreconditionFailedException;
import com.coverwise.insurance.exception.ResourceNotFoundException;
import com.coverwise.insurance.repository.CoverageTypeRepository;
import com.coverwise.insurance.repository.InsuranceApplicationRepository;
import com.coverwise.insurance.repository.InsuranceCompanyRepository;
import com.coverwise.insurance.repository.QuoteRecommendationRepository;
import com.coverwise.insurance.repository.QuoteRepository;
import com.coverwise.insurance.repository.RiderAddonRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Quote Ranking Service
 *
 * <p>Prices one approved application against every active insurer, stores a quote per
 * insurer and replaces the application's recommendations with the best-scored quotes.
 * The whole batch runs in one transaction with the application row locked, so a partial
 * batch is never visible and concurrent regenerations serialize.</p>
 *
 * <p>Nothing is sent to the customer from here; delivery is the caller's concern.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuoteRankingService {

    private final InsuranceApplicationRepository applicationRepository;
    private final InsuranceCompanyRepository insuranceCompanyRepository;
    private final CoverageTypeRepository coverageTypeRepository;
    private final RiderAddonRepository riderAddonRepository;
    private final QuoteRepository quoteRepository;
    private final QuoteRecommendationRepository recommendationRepository;
    private final PremiumCalculationService premiumCalculationService;
    private final QuoteScoringService quoteScoringService;
    private final CustomerContextLoader customerContextLoader;
    private final BusinessParameterService businessParameterService;
    private final ReferenceNumberGenerator referenceNumberGenerator;
    private final InsuranceEngineProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Generates and ranks quotes for an application.
     *
     * @param coverageIds selected coverage types; the type's mandatory coverages when empty
     * @param addonIds    selected add-ons; ids outside the application's insurance type are ignored
     */
    @Transactional
    public QuoteGenerationResult generateQuotes(UUID applicationId, Collection<UUID> coverageIds,
                                                Collection<UUID> addonIds, ActingUser actor) {
        Timer.Sample sample = Timer.start(meterRegistry);

        InsuranceApplication application = applicationRepository.findByIdForUpdate(applicationId)
                .orElseThrow(() -> new ResourceNotFoundException("Application", applicationId));

        if (!application.isApproved()) {
            throw new InvalidStateException("Application " + application.getApplicationNumber(),
                    application.getStatus().name(), ApplicationStatus.APPROVED.name());
        }

        List<InsuranceCompany> insurers = insuranceCompanyRepository.findByActiveTrueOrderByCompanyCodeAsc();
        if (insurers.isEmpty()) {
            throw new PreconditionFailedException("No active insurance companies are available for quoting");
        }

        UUID insuranceTypeId = application.getInsuranceType().getId();
        List<CoverageType> coverages = selectCoverages(insuranceTypeId, coverageIds);
        List<RiderAddon> addons = selectAddons(insuranceTypeId, addonIds);
        Set<UUID> selectedCoverageIds = coverages.stream().map(CoverageType::getId).collect(Collectors.toSet());

        LocalDateTime now = LocalDateTime.now(clock);
        BusinessParameters parameters = businessParameterService.currentParameters();
        CustomerContext customer = customerContextLoader.load(application.getCustomer(), now.toLocalDate());

        BigDecimal sumInsured = application.getRequestedCoverageAmount() != null
                ? application.getRequestedCoverageAmount()
                : properties.getQuotes().getDefaultSumInsured();
        int tenureMonths = application.getPolicyTenureMonths() != null
                ? application.getPolicyTenureMonths()
                : properties.getQuotes().getDefaultTenureMonths();

        // Slabs are insurer-agnostic, so every insurer's quote shares one breakdown
        PremiumBreakdown breakdown = premiumCalculationService.computeBreakdown(
                new PremiumRequest(insuranceTypeId, sumInsured, coverages, addons), customer, parameters);

        List<ScoredQuote> scored = new ArrayList<>();
        for (InsuranceCompany insurer : insurers) {
            QuoteScore score = quoteScoringService.score(breakdown, insurer, selectedCoverageIds, application);
            Quote quote = buildQuote(application, insurer, breakdown, score, sumInsured, tenureMonths,
                    parameters.quoteValidityDays(), now, actor);
            scored.add(new ScoredQuote(quoteRepository.save(quote), score));
        }
        // stable sort: equal scores keep insurer code order
        scored.sort(Comparator.comparing((ScoredQuote sq) -> sq.score().overall()).reversed());

        recommendationRepository.deleteByApplicationId(application.getId());
        List<QuoteRecommendation> recommendations = new ArrayList<>();
        int limit = Math.min(properties.getQuotes().getRecommendationCount(), scored.size());
        for (int rank = 1; rank <= limit; rank++) {
            ScoredQuote best = scored.get(rank - 1);
            recommendations.add(buildRecommendation(application, best.quote(), best.score(), rank, now));
        }
        recommendations = recommendationRepository.saveAll(recommendations);

        List<Quote> quotes = scored.stream().map(ScoredQuote::quote).toList();

        getQuotesGeneratedCounter(application.getInsuranceType().getTypeCode()).increment(quotes.size());
        sample.stop(getQuoteGenerationTimer());
        log.info("Generated {} quotes for application {} by {}; top recommendation {}",
                quotes.size(), application.getApplicationNumber(), actor.userId(),
                recommendations.isEmpty() ? "none" : recommendations.get(0).getQuote().getQuoteNumber());

        return new QuoteGenerationResult(quotes, recommendations);
    }

    @Transactional
    public Quote acceptQuote(UUID quoteId, ActingUser actor) {
        Quote quote = quoteRepository.findByIdForUpdate(quoteId)
                .orElseThrow(() -> new ResourceNotFoundException("Quote", quoteId));
        quote.accept(LocalDateTime.now(clock));
        log.info("Quote {} accepted by {}", quote.getQuoteNumber(), actor.userId());
        return quoteRepository.save(quote);
    }

    @Transactional
    public Quote rejectQuote(UUID quoteId, ActingUser actor) {
        Quote quote = quoteRepository.findByIdForUpdate(quoteId)
                .orElseThrow(() -> new ResourceNotFoundException("Quote", quoteId));
        quote.reject(LocalDateTime.now(clock));
        log.info("Quote {} rejected by {}", quote.getQuoteNumber(), actor.userId());
        return quoteRepository.save(quote);
    }

    /**
     * Every quote generated for the application, best score first. Regeneration adds a new
     * batch, so older batches are included.
     */
    @Transactional(readOnly = true)
    public List<Quote> getQuotes(UUID applicationId) {
        return quoteRepository.findByApplicationIdOrderByOverallScoreDesc(applicationId);
    }

    /**
     * The current recommendation set, rank 1 first.
     */
    @Transactional(readOnly = true)
    public List<QuoteRecommendation> getRecommendations(UUID applicationId) {
        return recommendationRepository.findByApplicationIdOrderByRecommendationRankAsc(applicationId);
    }

    private List<CoverageType> selectCoverages(UUID insuranceTypeId, Collection<UUID> coverageIds) {
        if (coverageIds == null || coverageIds.isEmpty()) {
            return coverageTypeRepository.findByInsuranceTypeIdAndMandatoryTrueAndActiveTrue(insuranceTypeId);
        }
        return coverageTypeRepository.findByInsuranceTypeIdAndActiveTrue(insuranceTypeId).stream()
                .filter(coverage -> coverageIds.contains(coverage.getId()))
                .toList();
    }

    private List<RiderAddon> selectAddons(UUID insuranceTypeId, Collection<UUID> addonIds) {
        if (addonIds == null || addonIds.isEmpty()) {
            return List.of();
        }
        return riderAddonRepository.findByInsuranceTypeIdAndActiveTrue(insuranceTypeId).stream()
                .filter(addon -> addonIds.contains(addon.getId()))
                .toList();
    }

    private Quote buildQuote(InsuranceApplication application, InsuranceCompany insurer, PremiumBreakdown breakdown,
                             QuoteScore score, BigDecimal sumInsured, int tenureMonths, int validityDays,
                             LocalDateTime now, ActingUser actor) {
        List<QuoteLineItem> lineItems = new ArrayList<>();
        for (PremiumLine line : breakdown.coverageLines()) {
            lineItems.add(new QuoteLineItem(ItemType.COVERAGE, line.code(), money(line.amount())));
        }
        for (PremiumLine line : breakdown.addonLines()) {
            lineItems.add(new QuoteLineItem(ItemType.ADDON, line.code(), money(line.amount())));
        }
        List<QuoteDiscountLine> discountLines = new ArrayList<>();
        for (AppliedDiscount discount : breakdown.appliedDiscounts()) {
            discountLines.add(new QuoteDiscountLine(discount.ruleCode(), discount.ruleName(), money(discount.amount())));
        }

        return Quote.builder()
                .quoteNumber(referenceNumberGenerator.next(properties.getQuotes().getQuoteNumberPrefix()))
                .application(application)
                .insuranceCompany(insurer)
                .status(QuoteStatus.GENERATED)
                .sumInsured(sumInsured)
                .tenureMonths(tenureMonths)
                .basePremium(money(breakdown.basePremium()))
                .coveragePremium(money(breakdown.coveragePremium()))
                .addonPremium(money(breakdown.addonPremium()))
                .subtotal(money(breakdown.subtotal()))
                .riskAdjustmentPercentage(breakdown.riskPercentage())
                .riskAdjustmentAmount(money(breakdown.riskAdjustment()))
                .riskCategory(breakdown.riskCategory())
                .discountAmount(money(breakdown.totalDiscount()))
                .fleetDiscountAmount(money(breakdown.fleetDiscount()))
                .netPremium(money(breakdown.netPremium()))
                .gstRate(breakdown.gstRate())
                .gstAmount(money(breakdown.gstAmount()))
                .totalPremium(money(breakdown.totalPremium()))
                .overallScore(score.overall())
                .affordabilityScore(score.affordability())
                .claimRatioScore(score.claimRatio())
                .coverageScore(score.coverage())
                .serviceRatingScore(score.serviceRating())
                .validityDays(validityDays)
                .generatedBy(actor.userId())
                .generatedAt(now)
                .expiryAt(now.plusDays(validityDays))
                .lineItems(lineItems)
                .discountLines(discountLines)
                .build();
    }

    private QuoteRecommendation buildRecommendation(InsuranceApplication application, Quote quote, QuoteScore score,
                                                    int rank, LocalDateTime now) {
        return QuoteRecommendation.builder()
                .application(application)
                .quote(quote)
                .recommendationRank(rank)
                .recommendationReason(score.rationale())
                .suitabilityScore(score.overall())
                .affordabilityScore(score.affordability())
                .claimRatioScore(score.claimRatio())
                .coverageScore(score.coverage())
                .serviceRatingScore(score.serviceRating())
                .createdAt(now)
                .build();
    }

    private record ScoredQuote(Quote quote, QuoteScore score) {
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    private Counter getQuotesGeneratedCounter(String insuranceType) {
        return Counter.builder("insurance_quotes_generated_total")
                .description("Total number of quotes generated")
                .tag("service", "insurance-service")
                .tag("insurance_type", insuranceType)
                .register(meterRegistry);
    }

    private Timer getQuoteGenerationTimer() {
        return Timer.builder("insurance_quote_generation_latency")
                .description("Latency of generating and ranking quotes for one application")
                .tag("service", "insurance-service")
                .register(meterRegistry);
    }
}
