package com.coverwise.insurance.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.Period;
import java.util.UUID;

@Entity
@Table(name = "customer_profiles", indexes = {
    @Index(name = "idx_customer_user", columnList = "user_id", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "full_name", nullable = false)
    private String fullName;

    @Column(name = "email")
    private String email;

    @Column(name = "date_of_birth")
    private LocalDate dateOfBirth;

    @Column(name = "annual_income", precision = 19, scale = 4)
    private BigDecimal annualIncome;

    /**
     * Age in whole years on the given date, or null when the date of birth is unknown.
     */
    public Integer ageOn(LocalDate date) {
        if (dateOfBirth == null) {
            return null;
        }
        return Period.between(dateOfBirth, date).getYears();
    }
}
