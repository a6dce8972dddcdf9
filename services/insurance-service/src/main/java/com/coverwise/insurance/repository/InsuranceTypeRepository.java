package com.coverwise.insurance.repository;

import com.coverwise.insurance.entity.InsuranceType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface InsuranceTypeRepository extends JpaRepository<InsuranceType, UUID> {
}
