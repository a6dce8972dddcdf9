package com.coverwise.insurance.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Ranked pointer to a quote with cached scores, replaced whenever quotes are regenerated.
 */
@Entity
@Table(name = "quote_recommendations", uniqueConstraints = {
    @UniqueConstraint(name = "uk_recommendation_application_rank", columnNames = {"application_id", "recommendation_rank"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuoteRecommendation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "application_id", nullable = false)
    private InsuranceApplication application;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "quote_id", nullable = false)
    private Quote quote;

    @Column(name = "recommendation_rank", nullable = false)
    private int recommendationRank;

    @Column(name = "recommendation_reason", nullable = false, length = 1000)
    private String recommendationReason;

    @Column(name = "suitability_score", nullable = false, precision = 5, scale = 2)
    private BigDecimal suitabilityScore;

    @Column(name = "affordability_score", nullable = false, precision = 5, scale = 2)
    private BigDecimal affordabilityScore;

    @Column(name = "claim_ratio_score", nullable = false, precision = 5, scale = 2)
    private BigDecimal claimRatioScore;

    @Column(name = "coverage_score", nullable = false, precision = 5, scale = 2)
    private BigDecimal coverageScore;

    @Column(name = "service_rating_score", nullable = false, precision = 5, scale = 2)
    private BigDecimal serviceRatingScore;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
