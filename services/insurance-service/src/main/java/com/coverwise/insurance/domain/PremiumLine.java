package com.coverwise.insurance.domain;

import java.math.BigDecimal;

public record PremiumLine(
    String code,
    BigDecimal amount
) {
}
