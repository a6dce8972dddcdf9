package com.coverwise.insurance.repository;

import com.coverwise.insurance.entity.Fleet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FleetRepository extends JpaRepository<Fleet, UUID> {

    List<Fleet> findByCustomerIdAndActiveTrueOrderByFleetNameAsc(UUID customerId);
}
