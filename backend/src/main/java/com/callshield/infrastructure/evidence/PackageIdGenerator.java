package com.callshield.infrastructure.evidence;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic package id allocator, safe under concurrent allocation: {@code EVP-yyyyMMdd-000042}.
 */
@Component
public class PackageIdGenerator {

    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public PackageIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        return String.format("EVP-%s-%06d", LocalDate.now(clock).format(DAY), sequence.incrementAndGet());
    }
}
