package com.coverwise.insurance.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Selected coverage or add-on with the premium it contributed.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuoteLineItem {

    @Enumerated(EnumType.STRING)
    @Column(name = "item_type", nullable = false, length = 20)
    private ItemType itemType;

    @Column(name = "item_code", nullable = false, length = 30)
    private String itemCode;

    @Column(name = "premium", nullable = false, precision = 19, scale = 4)
    private BigDecimal premium;

    public enum ItemType {
        COVERAGE,
        ADDON
    }
}
