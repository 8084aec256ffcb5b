package com.ryuqq.dealstore.core.context;

import java.time.LocalDate;
import java.util.Random;

/**
 * Reproducible id generator backed by {@link Random} with a fixed seed.
 *
 * <p>For each id, eight hex characters are drawn first and then a day offset in
 * {@code [0, 365)} from the base date. The same seed and base date yield the same id
 * sequence in every JVM, which makes synthetic data sets replayable.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public final class SeededDealIdGenerator implements DealIdGenerator {

    public static final LocalDate DEFAULT_BASE_DATE = LocalDate.of(2025, 1, 1);

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private final Random random;
    private final LocalDate baseDate;

    public SeededDealIdGenerator(long seed) {
        this(seed, DEFAULT_BASE_DATE);
    }

    public SeededDealIdGenerator(long seed, LocalDate baseDate) {
        if (baseDate == null) {
            throw new IllegalArgumentException("baseDate cannot be null");
        }
        this.random = new Random(seed);
        this.baseDate = baseDate;
    }

    @Override
    public synchronized String generate() {
        char[] hex = new char[8];
        for (int i = 0; i < hex.length; i++) {
            hex[i] = HEX[random.nextInt(HEX.length)];
        }
        LocalDate date = baseDate.plusDays(random.nextInt(365));
        return "D-" + date.format(RandomDealIdGenerator.ID_DATE) + "-" + new String(hex);
    }
}
