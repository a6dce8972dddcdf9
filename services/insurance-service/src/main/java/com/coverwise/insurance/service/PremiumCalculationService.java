package com.coverwise.insurance.service;

import com.coverwise.insurance.config.InsuranceEngineProperties;
import com.coverwise.insurance.domain.BusinessParameters;
import com.coverwise.insurance.domain.CustomerContext;
import com.coverwise.insurance.domain.DiscountOutcome;
import com.coverwise.insurance.domain.PremiumBreakdown;
import com.coverwise.insurance.domain.PremiumLine;
import com.coverwise.insurance.domain.PremiumRequest;
import com.coverwise.insurance.entity.CoverageType;
import com.coverwise.insurance.entity.Fleet;
import com.coverwise.insurance.entity.PremiumSlab;
import com.coverwise.insurance.entity.RiderAddon;
import com.coverwise.insurance.repository.DiscountRuleRepository;
import com.coverwise.insurance.repository.PremiumSlabRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Premium Calculator
 *
 * <pre>
 * base      = slab.basePremium + amount * slab.markup%     (amount * fallbackRate% without a slab)
 * subtotal  = base + coverage premiums + add-on premiums   (add-on = base * pct%, capped)
 * net       = max(0, subtotal + risk% - rule discounts - fleet discount%)
 * total     = net + net * GST%
 * </pre>
 *
 * Percentages are applied exactly; rounding to currency happens when a quote is stored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PremiumCalculationService {

    private final PremiumSlabRepository premiumSlabRepository;
    private final DiscountRuleRepository discountRuleRepository;
    private final DiscountRuleEvaluator discountRuleEvaluator;
    private final InsuranceEngineProperties properties;

    @Transactional(readOnly = true)
    public PremiumBreakdown computeBreakdown(PremiumRequest request, CustomerContext customer,
                                             BusinessParameters parameters) {
        BigDecimal coverageAmount = request.coverageAmount();

        // 1. Base premium from slab
        PremiumSlab slab = findSlab(request);
        BigDecimal basePremium = slab != null
                ? slab.getBasePremium().add(percentOf(coverageAmount, slab.getPercentageMarkup()))
                : percentOf(coverageAmount, properties.getPricing().getFallbackBaseRate());

        // 2. Coverage line items
        List<PremiumLine> coverageLines = new ArrayList<>();
        BigDecimal coveragePremium = BigDecimal.ZERO;
        for (CoverageType coverage : request.coverages()) {
            coverageLines.add(new PremiumLine(coverage.getCoverageCode(), coverage.getBasePremiumPerUnit()));
            coveragePremium = coveragePremium.add(coverage.getBasePremiumPerUnit());
        }

        // 3. Add-ons, priced off the base premium
        List<PremiumLine> addonLines = new ArrayList<>();
        BigDecimal addonPremium = BigDecimal.ZERO;
        for (RiderAddon addon : request.addons()) {
            BigDecimal premium = percentOf(basePremium, addon.getPremiumPercentage());
            if (addon.getMaxCoverageLimit() != null && premium.compareTo(addon.getMaxCoverageLimit()) > 0) {
                premium = addon.getMaxCoverageLimit();
            }
            addonLines.add(new PremiumLine(addon.getAddonCode(), premium));
            addonPremium = addonPremium.add(premium);
        }

        BigDecimal subtotal = basePremium.add(coveragePremium).add(addonPremium);

        // 4. Risk loading
        BigDecimal riskAdjustment = percentOf(subtotal, customer.riskPercentage());

        // 5. Rule-based discounts
        DiscountOutcome discounts = discountRuleEvaluator.evaluate(
                discountRuleRepository.findActiveForType(request.insuranceTypeId()), subtotal, customer);

        // 6. Fleet discount, additive to the rule discounts
        BigDecimal fleetPercentage = customer.primaryFleet()
                .map(Fleet::getDiscountPercentage)
                .orElse(BigDecimal.ZERO);
        BigDecimal fleetDiscount = percentOf(subtotal, fleetPercentage);

        BigDecimal netPremium = subtotal.add(riskAdjustment)
                .subtract(discounts.totalDiscount())
                .subtract(fleetDiscount)
                .max(BigDecimal.ZERO);

        BigDecimal gstAmount = percentOf(netPremium, parameters.gstRate());
        BigDecimal totalPremium = netPremium.add(gstAmount);

        log.debug("Premium for amount {}: subtotal={}, risk={}, discounts={}, fleet={}, net={}, total={}",
                coverageAmount, subtotal, riskAdjustment, discounts.totalDiscount(), fleetDiscount, netPremium, totalPremium);

        return new PremiumBreakdown(
                coverageAmount,
                slab != null ? slab.getSlabName() : null,
                basePremium,
                coverageLines,
                coveragePremium,
                addonLines,
                addonPremium,
                subtotal,
                customer.riskPercentage(),
                customer.riskCategory(),
                riskAdjustment,
                discounts.applied(),
                discounts.totalDiscount(),
                fleetPercentage,
                fleetDiscount,
                netPremium,
                parameters.gstRate(),
                gstAmount,
                totalPremium);
    }

    private PremiumSlab findSlab(PremiumRequest request) {
        List<PremiumSlab> slabs = premiumSlabRepository.findActiveContaining(
                request.insuranceTypeId(), request.coverageAmount());
        if (slabs.isEmpty()) {
            log.info("No premium slab covers amount {} for insurance type {}, using fallback rate",
                    request.coverageAmount(), request.insuranceTypeId());
            return null;
        }
        if (slabs.size() > 1) {
            log.warn("{} active premium slabs overlap at amount {} for insurance type {}, using {}",
                    slabs.size(), request.coverageAmount(), request.insuranceTypeId(), slabs.get(0).getSlabName());
        }
        return slabs.get(0);
    }

    static BigDecimal percentOf(BigDecimal amount, BigDecimal percentage) {
        if (percentage == null) {
            return BigDecimal.ZERO;
        }
        return amount.multiply(percentage).movePointLeft(2);
    }
}
