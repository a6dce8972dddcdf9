package com.coverwise.insurance.repository;

import com.coverwise.insurance.entity.DiscountRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DiscountRuleRepository extends JpaRepository<DiscountRule, UUID> {

    /**
     * Active rules for the type plus type-agnostic rules, highest priority first.
     */
    @Query("SELECT r FROM DiscountRule r LEFT JOIN r.insuranceType t " +
           "WHERE r.active = true AND (t IS NULL OR t.id = :insuranceTypeId) " +
           "ORDER BY r.priority DESC, r.ruleCode ASC")
    List<DiscountRule> findActiveForType(@Param("insuranceTypeId") UUID insuranceTypeId);
}
