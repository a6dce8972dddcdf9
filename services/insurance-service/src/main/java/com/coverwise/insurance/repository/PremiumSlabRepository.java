package com.coverwise.insurance.repository;

import com.coverwise.insurance.entity.PremiumSlab;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Repository
public interface PremiumSlabRepository extends JpaRepository<PremiumSlab, UUID> {

    /**
     * Active slabs of a type whose inclusive range contains the amount, lowest band first.
     */
    @Query("SELECT s FROM PremiumSlab s WHERE s.insuranceType.id = :insuranceTypeId AND s.active = true " +
           "AND s.minCoverageAmount <= :amount AND s.maxCoverageAmount >= :amount " +
           "ORDER BY s.minCoverageAmount ASC")
    List<PremiumSlab> findActiveContaining(@Param("insuranceTypeId") UUID insuranceTypeId,
                                           @Param("amount") BigDecimal amount);
}
