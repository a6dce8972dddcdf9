package com.coverwise.insurance.repository;

import com.coverwise.insurance.entity.BusinessParameter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BusinessParameterRepository extends JpaRepository<BusinessParameter, UUID> {

    List<BusinessParameter> findByActiveTrue();
}
