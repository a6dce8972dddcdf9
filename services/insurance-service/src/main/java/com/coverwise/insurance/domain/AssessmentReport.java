package com.coverwise.insurance.domain;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Surveyor's report for a pending assessment.
 *
 * @param deductible defaults to zero when null
 */
public record AssessmentReport(
    String damageAssessment,
    BigDecimal lossAmount,
    BigDecimal deductible,
    Map<String, Object> findings
) {
}
