package com.coverwise.insurance.service;

import com.coverwise.insurance.config.InsuranceEngineProperties;
import com.coverwise.insurance.domain.BusinessParameters;
import com.coverwise.insurance.entity.BusinessParameter;
import com.coverwise.insurance.repository.BusinessParameterRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BusinessParameterServiceTest {

    @Mock
    private BusinessParameterRepository businessParameterRepository;

    private BusinessParameterService businessParameterService;

    @BeforeEach
    void setUp() {
        businessParameterService = new BusinessParameterService(businessParameterRepository, new InsuranceEngineProperties());
    }

    private static BusinessParameter parameter(String key, String value) {
        return BusinessParameter.builder().paramKey(key).paramValue(value).active(true).build();
    }

    @Test
    void shouldUseConfiguredDefaultsWithoutRows() {
        when(businessParameterRepository.findByActiveTrue()).thenReturn(List.of());

        BusinessParameters parameters = businessParameterService.currentParameters();

        assertThat(parameters.gstRate()).isEqualByComparingTo("18");
        assertThat(parameters.quoteValidityDays()).isEqualTo(30);
        assertThat(parameters.claimSlaDays()).isEqualTo(15);
    }

    @Test
    void shouldOverrideDefaultsWithActiveRows() {
        when(businessParameterRepository.findByActiveTrue()).thenReturn(List.of(
                parameter(BusinessParameter.GST_RATE, "12.5"),
                parameter(BusinessParameter.QUOTE_VALIDITY_DAYS, " 45 "),
                parameter(BusinessParameter.CLAIM_SLA_DAYS, "21")));

        BusinessParameters parameters = businessParameterService.currentParameters();

        assertThat(parameters.gstRate()).isEqualByComparingTo("12.5");
        assertThat(parameters.quoteValidityDays()).isEqualTo(45);
        assertThat(parameters.claimSlaDays()).isEqualTo(21);
    }

    @Test
    void shouldKeepDefaultForUnparseableValue() {
        when(businessParameterRepository.findByActiveTrue()).thenReturn(List.of(
                parameter(BusinessParameter.GST_RATE, "eighteen"),
                parameter(BusinessParameter.QUOTE_VALIDITY_DAYS, "30.5")));

        BusinessParameters parameters = businessParameterService.currentParameters();

        assertThat(parameters.gstRate()).isEqualByComparingTo("18");
        assertThat(parameters.quoteValidityDays()).isEqualTo(30);
    }
}
