package com.coverwise.insurance.repository;

import com.coverwise.insurance.entity.RiderAddon;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RiderAddonRepository extends JpaRepository<RiderAddon, UUID> {

    List<RiderAddon> findByInsuranceTypeIdAndActiveTrue(UUID insuranceTypeId);
}
