package com.coverwise.insurance.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Entity
@Table(name = "eligibility_rules", indexes = {
    @Index(name = "idx_eligibility_rule_type", columnList = "insurance_type_id, active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EligibilityRule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "insurance_type_id", nullable = false)
    private InsuranceType insuranceType;

    @Column(name = "rule_name", nullable = false)
    private String ruleName;

    @Convert(converter = JsonNodeConverter.class)
    @Column(name = "rule_condition", columnDefinition = "TEXT")
    private JsonNode ruleCondition;

    @Column(name = "priority", nullable = false)
    private int priority;

    @Column(name = "error_message", nullable = false, length = 500)
    private String errorMessage;

    @Column(name = "active", nullable = false)
    private boolean active;
}
