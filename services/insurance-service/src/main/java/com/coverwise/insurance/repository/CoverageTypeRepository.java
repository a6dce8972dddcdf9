package com.coverwise.insurance.repository;

import com.coverwise.insurance.entity.CoverageType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CoverageTypeRepository extends JpaRepository<CoverageType, UUID> {

    List<CoverageType> findByInsuranceTypeIdAndActiveTrue(UUID insuranceTypeId);

    List<CoverageType> findByInsuranceTypeIdAndMandatoryTrueAndActiveTrue(UUID insuranceTypeId);
}
