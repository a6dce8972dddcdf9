package com.coverwise.insurance.repository;

import com.coverwise.insurance.entity.CustomerClaimHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CustomerClaimHistoryRepository extends JpaRepository<CustomerClaimHistory, UUID> {

    /**
     * Most recent year first.
     */
    List<CustomerClaimHistory> findByCustomerIdOrderByClaimYearDesc(UUID customerId);
}
