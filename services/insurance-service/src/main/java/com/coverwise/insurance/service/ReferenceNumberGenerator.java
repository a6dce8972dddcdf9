package com.coverwise.insurance.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.UUID;

/**
 * Human-readable numbers of the form {@code PREFIX-yyyyMMdd-XXXXXXXX}.
 */
@Component
@RequiredArgsConstructor
public class ReferenceNumberGenerator {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Clock clock;

    public String next(String prefix) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
        return prefix + "-" + LocalDate.now(clock).format(DATE_FORMAT) + "-" + suffix;
    }
}
