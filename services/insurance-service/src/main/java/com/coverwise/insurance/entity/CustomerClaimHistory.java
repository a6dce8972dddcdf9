package com.coverwise.insurance.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Yearly claim aggregate for a customer.
 */
@Entity
@Table(name = "customer_claim_histories", uniqueConstraints = {
    @UniqueConstraint(name = "uk_claim_history_customer_year", columnNames = {"customer_id", "claim_year"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerClaimHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "customer_id", nullable = false)
    private CustomerProfile customer;

    @Column(name = "claim_year", nullable = false)
    private int claimYear;

    @Column(name = "claim_count", nullable = false)
    private int claimCount;

    /**
     * Percentage of claims rejected in the year, 0..100
     */
    @Column(name = "claim_rejection_rate", nullable = false, precision = 7, scale = 4)
    private BigDecimal claimRejectionRate;
}
