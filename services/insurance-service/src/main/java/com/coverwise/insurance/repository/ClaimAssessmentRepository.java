package com.coverwise.insurance.repository;

import com.coverwise.insurance.entity.ClaimAssessment;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ClaimAssessmentRepository extends JpaRepository<ClaimAssessment, UUID> {

    /**
     * Parent claim id without loading the assessment, so the claim can be locked first.
     */
    @Query("SELECT a.claim.id FROM ClaimAssessment a WHERE a.id = :id")
    Optional<UUID> findClaimIdById(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM ClaimAssessment a WHERE a.id = :id")
    Optional<ClaimAssessment> findByIdForUpdate(@Param("id") UUID id);
}
