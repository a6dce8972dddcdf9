package com.coverwise.insurance.repository;

import com.coverwise.insurance.entity.ClaimApprovalThreshold;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Repository
public interface ClaimApprovalThresholdRepository extends JpaRepository<ClaimApprovalThreshold, UUID> {

    @Query("SELECT t FROM ClaimApprovalThreshold t WHERE t.insuranceType.id = :insuranceTypeId AND t.active = true " +
           "AND t.minAmount <= :amount AND t.maxAmount >= :amount " +
           "ORDER BY t.minAmount ASC")
    List<ClaimApprovalThreshold> findActiveContaining(@Param("insuranceTypeId") UUID insuranceTypeId,
                                                      @Param("amount") BigDecimal amount);
}
