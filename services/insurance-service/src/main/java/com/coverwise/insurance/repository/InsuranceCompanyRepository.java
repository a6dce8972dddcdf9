package com.coverwise.insurance.repository;

import com.coverwise.insurance.entity.InsuranceCompany;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface InsuranceCompanyRepository extends JpaRepository<InsuranceCompany, UUID> {

    List<InsuranceCompany> findByActiveTrueOrderByCompanyCodeAsc();
}
