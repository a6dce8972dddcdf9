package com.coverwise.insurance.service;

import com.coverwise.insurance.config.InsuranceEngineProperties;
import com.coverwise.insurance.domain.BusinessParameters;
import com.coverwise.insurance.entity.BusinessParameter;
import com.coverwise.insurance.repository.BusinessParameterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Builds the business parameter snapshot an operation works with: active parameter rows
 * override the configured defaults.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BusinessParameterService {

    private final BusinessParameterRepository businessParameterRepository;
    private final InsuranceEngineProperties properties;

    @Transactional(readOnly = true)
    public BusinessParameters currentParameters() {
        Map<String, String> values = new HashMap<>();
        for (BusinessParameter parameter : businessParameterRepository.findByActiveTrue()) {
            values.put(parameter.getParamKey(), parameter.getParamValue());
        }

        return new BusinessParameters(
                decimalParameter(values, BusinessParameter.GST_RATE, properties.getPricing().getDefaultGstRate()),
                intParameter(values, BusinessParameter.QUOTE_VALIDITY_DAYS, properties.getQuotes().getDefaultValidityDays()),
                intParameter(values, BusinessParameter.CLAIM_SLA_DAYS, properties.getClaims().getDefaultSlaDays()));
    }

    private BigDecimal decimalParameter(Map<String, String> values, String key, BigDecimal defaultValue) {
        String raw = values.get(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Business parameter {} has non-numeric value '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private int intParameter(Map<String, String> values, String key, int defaultValue) {
        String raw = values.get(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Business parameter {} has non-integer value '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }
}
