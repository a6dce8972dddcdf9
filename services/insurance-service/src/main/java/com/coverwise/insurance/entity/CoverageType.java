package com.coverwise.insurance.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "coverage_types", indexes = {
    @Index(name = "idx_coverage_type_insurance_type", columnList = "insurance_type_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoverageType {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "insurance_type_id", nullable = false)
    private InsuranceType insuranceType;

    @Column(name = "coverage_code", nullable = false, length = 30)
    private String coverageCode;

    @Column(name = "coverage_name", nullable = false)
    private String coverageName;

    @Column(name = "mandatory", nullable = false)
    private boolean mandatory;

    /**
     * Flat premium charged when this coverage is selected
     */
    @Column(name = "base_premium_per_unit", nullable = false, precision = 19, scale = 4)
    private BigDecimal basePremiumPerUnit;

    @Column(name = "active", nullable = false)
    private boolean active;
}
