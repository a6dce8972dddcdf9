package com.coverwise.insurance.service;

import org.junit.jupiter.api.Test;

import static com.coverwise.insurance.TestFixtures.FIXED_CLOCK;
import static org.assertj.core.api.Assertions.assertThat;

class ReferenceNumberGeneratorTest {

    private final ReferenceNumberGenerator generator = new ReferenceNumberGenerator(FIXED_CLOCK);

    @Test
    void shouldFormatPrefixDateAndSuffix() {
        assertThat(generator.next("CLM")).matches("CLM-20260315-[0-9A-F]{8}");
    }

    @Test
    void shouldNotRepeatWithinTheSameDay() {
        assertThat(generator.next("QT")).isNotEqualTo(generator.next("QT"));
    }
}
