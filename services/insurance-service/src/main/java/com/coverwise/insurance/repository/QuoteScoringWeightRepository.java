package com.coverwise.insurance.repository;

import com.coverwise.insurance.entity.QuoteScoringWeight;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface QuoteScoringWeightRepository extends JpaRepository<QuoteScoringWeight, UUID> {

    List<QuoteScoringWeight> findByInsuranceTypeIdAndActiveTrue(UUID insuranceTypeId);
}
