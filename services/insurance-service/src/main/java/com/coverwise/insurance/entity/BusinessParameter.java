package com.coverwise.insurance.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Keyed business setting such as GST_RATE or CLAIM_SLA_DAYS.
 */
@Entity
@Table(name = "business_parameters")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessParameter {

    public static final String GST_RATE = "GST_RATE";
    public static final String QUOTE_VALIDITY_DAYS = "QUOTE_VALIDITY_DAYS";
    public static final String CLAIM_SLA_DAYS = "CLAIM_SLA_DAYS";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "param_key", unique = true, nullable = false, length = 100)
    private String paramKey;

    @Column(name = "param_value", nullable = false)
    private String paramValue;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "active", nullable = false)
    private boolean active;
}
