package com.coverwise.insurance.repository;

import com.coverwise.insurance.entity.CustomerRiskProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CustomerRiskProfileRepository extends JpaRepository<CustomerRiskProfile, UUID> {

    Optional<CustomerRiskProfile> findByCustomerId(UUID customerId);
}
