package com.coverwise.insurance.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Engine defaults. Active business parameter rows override the GST rate, quote validity
 * and claim SLA at call time.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "insurance.engine")
public class InsuranceEngineProperties {

    @Valid
    private PricingProperties pricing = new PricingProperties();
    @Valid
    private QuoteProperties quotes = new QuoteProperties();
    @Valid
    private ClaimProperties claims = new ClaimProperties();
    @Valid
    private ScoringProperties scoring = new ScoringProperties();

    @Data
    public static class PricingProperties {
        @NotNull
        private BigDecimal defaultGstRate = new BigDecimal("18");
        /**
         * Percent of the coverage amount charged as base premium when no slab matches
         */
        @NotNull
        private BigDecimal fallbackBaseRate = new BigDecimal("2");
        @NotBlank
        private String defaultRiskCategory = "MEDIUM";
    }

    @Data
    public static class QuoteProperties {
        @Min(1)
        private int defaultValidityDays = 30;
        @NotNull
        private BigDecimal defaultSumInsured = new BigDecimal("500000");
        @Min(1)
        private int defaultTenureMonths = 12;
        @Min(1)
        private int recommendationCount = 3;
        @NotBlank
        private String quoteNumberPrefix = "QT";
    }

    @Data
    public static class ClaimProperties {
        @Min(1)
        private int defaultSlaDays = 15;
        @NotBlank
        private String claimNumberPrefix = "CLM";
        @Min(1)
        private int userAgentMaxLength = 500;
    }

    @Data
    public static class ScoringProperties {
        private boolean useConfiguredWeights = false;
    }
}
