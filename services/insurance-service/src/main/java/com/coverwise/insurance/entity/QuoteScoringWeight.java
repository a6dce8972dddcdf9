package com.coverwise.insurance.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Per-type weight of one scoring factor. Only read when configured weights are enabled.
 */
@Entity
@Table(name = "quote_scoring_weights", uniqueConstraints = {
    @UniqueConstraint(name = "uk_scoring_weight_type_factor", columnNames = {"insurance_type_id", "factor"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuoteScoringWeight {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "insurance_type_id", nullable = false)
    private InsuranceType insuranceType;

    @Enumerated(EnumType.STRING)
    @Column(name = "factor", nullable = false, length = 30)
    private ScoringFactor factor;

    /**
     * Weight in [0,1]
     */
    @Column(name = "factor_weight", nullable = false, precision = 5, scale = 4)
    private BigDecimal factorWeight;

    @Column(name = "active", nullable = false)
    private boolean active;

    public enum ScoringFactor {
        AFFORDABILITY,
        CLAIM_RATIO,
        COVERAGE,
        SERVICE_RATING
    }
}
