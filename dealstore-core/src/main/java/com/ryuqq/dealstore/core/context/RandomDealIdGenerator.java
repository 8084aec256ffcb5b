package com.ryuqq.dealstore.core.context;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.UUID;

/**
 * Production id generator: {@code D-{UTC date}-{8 hex chars of a random UUID}}.
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public final class RandomDealIdGenerator implements DealIdGenerator {

    static final DateTimeFormatter ID_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Clock clock;

    public RandomDealIdGenerator(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public String generate() {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        String hex = UUID.randomUUID().toString().replace("-", "")
            .substring(0, 8)
            .toUpperCase(Locale.ROOT);
        return "D-" + today.format(ID_DATE) + "-" + hex;
    }
}
