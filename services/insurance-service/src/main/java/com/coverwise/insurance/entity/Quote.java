package com.coverwise.insurance.entity;

import com.coverwise.insurance.exception.InvalidStateException;
import com.coverwise.insurance.exception.QuoteExpiredException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Priced offer from one insurer for one application.
 *
 * <p>The premium breakdown and scores are fixed at generation. Only the status and its
 * timestamp change afterwards, through {@link #accept} and {@link #reject}. Expiry is
 * never stored: {@link #effectiveStatus} derives it from {@code expiryAt} at read time.</p>
 */
@Entity
@Table(name = "quotes", indexes = {
    @Index(name = "idx_quote_application", columnList = "application_id"),
    @Index(name = "idx_quote_status", columnList = "status")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Quote {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "quote_number", unique = true, nullable = false, length = 30)
    private String quoteNumber;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "application_id", nullable = false, updatable = false)
    private InsuranceApplication application;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "insurance_company_id", nullable = false, updatable = false)
    private InsuranceCompany insuranceCompany;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private QuoteStatus status;

    @Column(name = "sum_insured", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal sumInsured;

    @Column(name = "tenure_months", nullable = false, updatable = false)
    private int tenureMonths;

    @Column(name = "base_premium", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal basePremium;

    @Column(name = "coverage_premium", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal coveragePremium;

    @Column(name = "addon_premium", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal addonPremium;

    @Column(name = "subtotal", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal subtotal;

    @Column(name = "risk_adjustment_percentage", nullable = false, updatable = false, precision = 7, scale = 4)
    private BigDecimal riskAdjustmentPercentage;

    @Column(name = "risk_adjustment_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal riskAdjustmentAmount;

    @Column(name = "risk_category", nullable = false, updatable = false, length = 20)
    private String riskCategory;

    @Column(name = "discount_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal discountAmount;

    @Column(name = "fleet_discount_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal fleetDiscountAmount;

    @Column(name = "net_premium", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal netPremium;

    @Column(name = "gst_rate", nullable = false, updatable = false, precision = 7, scale = 4)
    private BigDecimal gstRate;

    @Column(name = "gst_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal gstAmount;

    @Column(name = "total_premium", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal totalPremium;

    @Column(name = "overall_score", nullable = false, updatable = false, precision = 5, scale = 2)
    private BigDecimal overallScore;

    @Column(name = "affordability_score", nullable = false, updatable = false, precision = 5, scale = 2)
    private BigDecimal affordabilityScore;

    @Column(name = "claim_ratio_score", nullable = false, updatable = false, precision = 5, scale = 2)
    private BigDecimal claimRatioScore;

    @Column(name = "coverage_score", nullable = false, updatable = false, precision = 5, scale = 2)
    private BigDecimal coverageScore;

    @Column(name = "service_rating_score", nullable = false, updatable = false, precision = 5, scale = 2)
    private BigDecimal serviceRatingScore;

    @Column(name = "validity_days", nullable = false, updatable = false)
    private int validityDays;

    @Column(name = "generated_by", updatable = false)
    private String generatedBy;

    @Column(name = "generated_at", nullable = false, updatable = false)
    private LocalDateTime generatedAt;

    @Column(name = "expiry_at", nullable = false, updatable = false)
    private LocalDateTime expiryAt;

    @Column(name = "accepted_at")
    private LocalDateTime acceptedAt;

    @Column(name = "rejected_at")
    private LocalDateTime rejectedAt;

    @Builder.Default
    @ElementCollection
    @CollectionTable(name = "quote_line_items", joinColumns = @JoinColumn(name = "quote_id"))
    private List<QuoteLineItem> lineItems = new ArrayList<>();

    @Builder.Default
    @ElementCollection
    @CollectionTable(name = "quote_discount_lines", joinColumns = @JoinColumn(name = "quote_id"))
    private List<QuoteDiscountLine> discountLines = new ArrayList<>();

    public boolean isExpiredAt(LocalDateTime now) {
        return !now.isBefore(expiryAt);
    }

    /**
     * Stored status, except that an open quote past its expiry reads as EXPIRED.
     */
    public QuoteStatus effectiveStatus(LocalDateTime now) {
        if (status.isOpen() && isExpiredAt(now)) {
            return QuoteStatus.EXPIRED;
        }
        return status;
    }

    /**
     * Expiry is checked before status, so an expired quote always reports expiry.
     */
    public void accept(LocalDateTime now) {
        if (isExpiredAt(now)) {
            throw new QuoteExpiredException(quoteNumber, expiryAt);
        }
        if (status != QuoteStatus.GENERATED) {
            throw new InvalidStateException("Quote " + quoteNumber, status.name(), QuoteStatus.GENERATED.name());
        }
        this.status = QuoteStatus.ACCEPTED;
        this.acceptedAt = now;
    }

    public void reject(LocalDateTime now) {
        if (isExpiredAt(now)) {
            throw new QuoteExpiredException(quoteNumber, expiryAt);
        }
        if (status != QuoteStatus.GENERATED) {
            throw new InvalidStateException("Quote " + quoteNumber, status.name(), QuoteStatus.GENERATED.name());
        }
        this.status = QuoteStatus.REJECTED;
        this.rejectedAt = now;
    }

    public enum QuoteStatus {
        GENERATED,
        SENT,
        ACCEPTED,
        REJECTED,
        EXPIRED;

        public boolean isOpen() {
            return this == GENERATED || this == SENT;
        }
    }
}
