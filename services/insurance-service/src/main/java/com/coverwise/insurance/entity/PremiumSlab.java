package com.coverwise.insurance.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Coverage-amount band with its base premium and percentage markup.
 * Active slabs of one insurance type never overlap.
 */
@Entity
@Table(name = "premium_slabs", indexes = {
    @Index(name = "idx_slab_type_range", columnList = "insurance_type_id, min_coverage_amount, max_coverage_amount")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PremiumSlab {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "insurance_type_id", nullable = false)
    private InsuranceType insuranceType;

    @Column(name = "slab_name", nullable = false, length = 100)
    private String slabName;

    @Column(name = "min_coverage_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal minCoverageAmount;

    @Column(name = "max_coverage_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal maxCoverageAmount;

    @Column(name = "base_premium", nullable = false, precision = 19, scale = 4)
    private BigDecimal basePremium;

    @Column(name = "percentage_markup", nullable = false, precision = 7, scale = 4)
    private BigDecimal percentageMarkup;

    @Column(name = "active", nullable = false)
    private boolean active;
}
