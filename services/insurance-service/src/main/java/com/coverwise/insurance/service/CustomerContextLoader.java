package com.coverwise.insurance.service;

import com.coverwise.insurance.config.InsuranceEngineProperties;
import com.coverwise.insurance.domain.CustomerContext;
import com.coverwise.insurance.entity.CustomerProfile;
import com.coverwise.insurance.entity.CustomerRiskProfile;
import com.coverwise.insurance.repository.CustomerClaimHistoryRepository;
import com.coverwise.insurance.repository.CustomerRiskProfileRepository;
import com.coverwise.insurance.repository.FleetRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class CustomerContextLoader {

    private final CustomerRiskProfileRepository riskProfileRepository;
    private final FleetRepository fleetRepository;
    private final CustomerClaimHistoryRepository claimHistoryRepository;
    private final InsuranceEngineProperties properties;

    /**
     * A customer without a cached risk profile gets a zero risk adjustment and the default category.
     */
    public CustomerContext load(CustomerProfile customer, LocalDate today) {
        Optional<CustomerRiskProfile> riskProfile = riskProfileRepository.findByCustomerId(customer.getId());
        BigDecimal riskPercentage = riskProfile
                .map(CustomerRiskProfile::getOverallRiskPercentage)
                .orElse(BigDecimal.ZERO);
        String riskCategory = riskProfile
                .map(CustomerRiskProfile::getRiskCategory)
                .orElse(properties.getPricing().getDefaultRiskCategory());

        return new CustomerContext(
                customer,
                riskPercentage,
                riskCategory,
                fleetRepository.findByCustomerIdAndActiveTrueOrderByFleetNameAsc(customer.getId()),
                claimHistoryRepository.findByCustomerIdOrderByClaimYearDesc(customer.getId()),
                today);
    }
}
