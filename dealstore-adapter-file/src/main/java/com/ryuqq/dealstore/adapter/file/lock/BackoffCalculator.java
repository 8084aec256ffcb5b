package com.ryuqq.dealstore.adapter.file.lock;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Lock 재시도 간격 계산기 (Exponential Backoff with Jitter).
 *
 * <p>잠금 마커가 이미 존재할 때 다음 시도까지 기다릴 시간을 계산합니다.
 * 여러 프로세스가 동시에 재시도하지 않도록 jitter를 더합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = min(baseDelay * 2^(attempt-1), maxDelay)
 * delay       = min(exponential + random(0, exponential * jitterFactor), maxDelay)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=100ms, maxDelay=2000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempt=1: 100-110ms</li>
 *   <li>attempt=3: 400-440ms</li>
 *   <li>attempt=6: 2000ms (capped)</li>
 * </ul>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private static final int MAX_SHIFT = 62;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * @param baseDelayMs 첫 재시도 지연 (양수)
     * @param maxDelayMs 최대 지연 (baseDelayMs 이상)
     * @param jitterFactor jitter 비율 (0.0 ~ 1.0)
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급자를 주입하는 생성자 (테스트에서 jitter 고정용).
     *
     * @param random values in [0.0, 1.0)
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 재시도 전 대기 시간.
     *
     * @param attempt 실패한 시도 횟수 (1부터)
     * @return 대기 시간 (밀리초), maxDelayMs 이하
     */
    public long delayFor(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException(
                "attempt must be positive (current: " + attempt + ")"
            );
        }
        int shift = Math.min(attempt - 1, MAX_SHIFT);
        long multiplier = 1L << shift;
        long exponential = baseDelayMs > maxDelayMs / multiplier
            ? maxDelayMs
            : Math.min(baseDelayMs * multiplier, maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
