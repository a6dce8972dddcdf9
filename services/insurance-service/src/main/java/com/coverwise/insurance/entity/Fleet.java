package com.coverwise.insurance.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "fleets", indexes = {
    @Index(name = "idx_fleet_customer_active", columnList = "customer_id, active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Fleet {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "customer_id", nullable = false)
    private CustomerProfile customer;

    @Column(name = "fleet_name", nullable = false)
    private String fleetName;

    @Column(name = "vehicle_count", nullable = false)
    private int vehicleCount;

    /**
     * Discount from the fleet risk score; null until the fleet has been scored
     */
    @Column(name = "discount_percentage", precision = 7, scale = 4)
    private BigDecimal discountPercentage;

    @Column(name = "active", nullable = false)
    private boolean active;
}
