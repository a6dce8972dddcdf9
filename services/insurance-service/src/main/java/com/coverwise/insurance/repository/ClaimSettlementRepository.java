package com.coverwise.insurance.repository;

import com.coverwise.insurance.entity.ClaimSettlement;
import com.coverwise.insurance.entity.ClaimSettlement.SettlementStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ClaimSettlementRepository extends JpaRepository<ClaimSettlement, UUID> {

    boolean existsByClaimIdAndStatus(UUID claimId, SettlementStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM ClaimSettlement s WHERE s.id = :id")
    Optional<ClaimSettlement> findByIdForUpdate(@Param("id") UUID id);
}
