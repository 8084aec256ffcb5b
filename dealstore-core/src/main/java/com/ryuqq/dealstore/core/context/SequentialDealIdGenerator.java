package com.ryuqq.dealstore.core.context;

import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counter-based id generator for tests: {@code D-{baseDate}-00000001}, {@code -00000002}, ...
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public final class SequentialDealIdGenerator implements DealIdGenerator {

    private final String prefix;
    private final AtomicLong counter = new AtomicLong();

    public SequentialDealIdGenerator(LocalDate baseDate) {
        if (baseDate == null) {
            throw new IllegalArgumentException("baseDate cannot be null");
        }
        this.prefix = "D-" + baseDate.format(RandomDealIdGenerator.ID_DATE) + "-";
    }

    @Override
    public String generate() {
        return prefix + String.format("%08d", counter.incrementAndGet());
    }

    /**
     * Restarts numbering at 1.
     */
    public void reset() {
        counter.set(0);
    }
}
