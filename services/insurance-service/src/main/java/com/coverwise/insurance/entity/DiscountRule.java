package com.coverwise.insurance.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Conditional premium discount. A rule without an insurance type applies to every type.
 */
@Entity
@Table(name = "discount_rules", indexes = {
    @Index(name = "idx_discount_rule_type_active", columnList = "insurance_type_id, active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscountRule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "rule_code", unique = true, nullable = false, length = 50)
    private String ruleCode;

    @Column(name = "rule_name", nullable = false)
    private String ruleName;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "insurance_type_id")
    private InsuranceType insuranceType;

    @Convert(converter = JsonNodeConverter.class)
    @Column(name = "rule_condition", columnDefinition = "TEXT")
    private JsonNode ruleCondition;

    @Column(name = "discount_percentage", nullable = false, precision = 7, scale = 4)
    private BigDecimal discountPercentage;

    @Column(name = "discount_max_amount", precision = 19, scale = 4)
    private BigDecimal discountMaxAmount;

    @Column(name = "priority", nullable = false)
    private int priority;

    @Column(name = "combinable", nullable = false)
    private boolean combinable;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "effective_from")
    private LocalDate effectiveFrom;

    @Column(name = "effective_to")
    private LocalDate effectiveTo;

    /**
     * Both window bounds are inclusive; a missing bound is open.
     */
    public boolean isEffectiveOn(LocalDate date) {
        if (effectiveFrom != null && date.isBefore(effectiveFrom)) {
            return false;
        }
        return effectiveTo == null || !date.isAfter(effectiveTo);
    }
}
