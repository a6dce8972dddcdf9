package com.coverwise.insurance.repository;

import com.coverwise.insurance.entity.InsuranceApplication;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface InsuranceApplicationRepository extends JpaRepository<InsuranceApplication, UUID> {

    /**
     * Serializes quote generation for one application.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM InsuranceApplication a WHERE a.id = :id")
    Optional<InsuranceApplication> findByIdForUpdate(@Param("id") UUID id);
}
