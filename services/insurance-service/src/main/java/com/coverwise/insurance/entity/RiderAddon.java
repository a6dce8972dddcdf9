package com.coverwise.insurance.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "rider_addons", indexes = {
    @Index(name = "idx_addon_insurance_type", columnList = "insurance_type_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiderAddon {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "insurance_type_id", nullable = false)
    private InsuranceType insuranceType;

    @Column(name = "addon_code", nullable = false, length = 30)
    private String addonCode;

    @Column(name = "addon_name", nullable = false)
    private String addonName;

    /**
     * Percentage of the base premium charged for this add-on
     */
    @Column(name = "premium_percentage", nullable = false, precision = 7, scale = 4)
    private BigDecimal premiumPercentage;

    /**
     * Upper bound on the add-on premium; null means uncapped
     */
    @Column(name = "max_coverage_limit", precision = 19, scale = 4)
    private BigDecimal maxCoverageLimit;

    @Column(name = "active", nullable = false)
    private boolean active;
}
