package com.ryuqq.dealstore.core.context;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Source of time and identity for the write path.
 *
 * <p>Every component that would otherwise read the wall clock or generate a random id
 * (normalization, backup naming, metadata timestamps) takes a SystemContext instead.
 * Swapping this single object switches the whole write path between live and
 * replayable behaviour.</p>
 *
 * <p><strong>Factories:</strong></p>
 * <ul>
 *   <li>{@link #system()}: system clock + {@link RandomDealIdGenerator}</li>
 *   <li>{@link #forTesting(LocalDate)}: fixed clock at midnight UTC + {@link SequentialDealIdGenerator}</li>
 *   <li>{@link #forSyntheticData(LocalDate, long)}: fixed clock + {@link SeededDealIdGenerator}</li>
 *   <li>{@link #of(Clock, DealIdGenerator)}: any combination</li>
 * </ul>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public interface SystemContext {

    Clock clock();

    DealIdGenerator idGenerator();

    /**
     * Current date in the clock's zone.
     *
     * @return today according to {@link #clock()}
     */
    default LocalDate today() {
        return LocalDate.now(clock());
    }

    default Instant now() {
        return clock().instant();
    }

    static SystemContext of(Clock clock, DealIdGenerator idGenerator) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (idGenerator == null) {
            throw new IllegalArgumentException("idGenerator cannot be null");
        }
        return new Fixed(clock, idGenerator);
    }

    static SystemContext system() {
        Clock clock = Clock.systemDefaultZone();
        return new Fixed(clock, new RandomDealIdGenerator(clock));
    }

    static SystemContext forTesting(LocalDate date) {
        return of(fixedAt(date), new SequentialDealIdGenerator(date));
    }

    static SystemContext forSyntheticData(LocalDate date, long seed) {
        return of(fixedAt(date), new SeededDealIdGenerator(seed));
    }

    private static Clock fixedAt(LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
        return Clock.fixed(date.atStartOfDay(ZoneOffset.UTC).toInstant(), ZoneOffset.UTC);
    }

    /**
     * Immutable clock + generator pair.
     */
    record Fixed(Clock clock, DealIdGenerator idGenerator) implements SystemContext {
    }
}
