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
 * Cached risk assessment of a customer, maintained by the risk collaborator.
 */
@Entity
@Table(name = "customer_risk_profiles", indexes = {
    @Index(name = "idx_risk_profile_customer", columnList = "customer_id", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerRiskProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "customer_id", nullable = false)
    private CustomerProfile customer;

    @Column(name = "overall_risk_percentage", nullable = false, precision = 7, scale = 4)
    private BigDecimal overallRiskPercentage;

    /**
     * LOW, MEDIUM, HIGH
     */
    @Column(name = "risk_category", nullable = false, length = 20)
    private String riskCategory;

    @Column(name = "calculated_at")
    private LocalDateTime calculatedAt;
}
