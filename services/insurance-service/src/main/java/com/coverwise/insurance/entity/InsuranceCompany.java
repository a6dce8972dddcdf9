package com.coverwise.insurance.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "insurance_companies", indexes = {
    @Index(name = "idx_company_active", columnList = "active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InsuranceCompany {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "company_code", unique = true, nullable = false, length = 20)
    private String companyCode;

    @Column(name = "company_name", nullable = false)
    private String companyName;

    /**
     * Fraction of claims settled, 0..1
     */
    @Column(name = "claim_settlement_ratio", nullable = false, precision = 5, scale = 4)
    private BigDecimal claimSettlementRatio;

    /**
     * Customer service rating, 0..5
     */
    @Column(name = "service_rating", nullable = false, precision = 3, scale = 2)
    private BigDecimal serviceRating;

    @Column(name = "active", nullable = false)
    private boolean active;
}
