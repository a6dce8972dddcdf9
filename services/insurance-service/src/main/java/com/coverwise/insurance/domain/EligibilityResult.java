package com.coverwise.insurance.domain;

import java.util.List;

/**
 * @param failures error messages of the rules the application did not satisfy, highest priority first
 */
public record EligibilityResult(
    List<String> failures
) {
    public EligibilityResult {
        failures = List.copyOf(failures);
    }

    public boolean isEligible() {
        return failures.isEmpty();
    }
}
