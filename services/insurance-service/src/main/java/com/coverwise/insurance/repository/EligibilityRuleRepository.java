package com.coverwise.insurance.repository;

import com.coverwise.insurance.entity.EligibilityRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EligibilityRuleRepository extends JpaRepository<EligibilityRule, UUID> {

    List<EligibilityRule> findByInsuranceTypeIdAndActiveTrueOrderByPriorityDesc(UUID insuranceTypeId);
}
