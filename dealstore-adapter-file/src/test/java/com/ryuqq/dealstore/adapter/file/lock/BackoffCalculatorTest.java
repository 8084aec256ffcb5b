package com.ryuqq.dealstore.adapter.file.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 유닛 테스트.
 */
class BackoffCalculatorTest {

    @Test
    @DisplayName("jitter 없이 지수적으로 증가하고 maxDelay에서 멈춤")
    void delay_doublesUntilCap() {
        BackoffCalculator calculator = new BackoffCalculator(100, 2000, 0.0);

        assertThat(calculator.delayFor(1)).isEqualTo(100);
        assertThat(calculator.delayFor(2)).isEqualTo(200);
        assertThat(calculator.delayFor(3)).isEqualTo(400);
        assertThat(calculator.delayFor(5)).isEqualTo(1600);
        assertThat(calculator.delayFor(6)).isEqualTo(2000);
    }

    @Test
    void jitter_isBoundedByFactor() {
        BackoffCalculator calculator = new BackoffCalculator(100, 2000, 0.1, () -> 0.999);

        assertThat(calculator.delayFor(1)).isEqualTo(109);
        assertThat(calculator.delayFor(3)).isEqualTo(439);
    }

    @Test
    void jitter_neverExceedsMaxDelay() {
        BackoffCalculator calculator = new BackoffCalculator(100, 2000, 1.0, () -> 0.999);

        assertThat(calculator.delayFor(5)).isEqualTo(2000);
    }

    @Test
    @DisplayName("큰 시도 횟수에서도 overflow 없음")
    void hugeAttempt_doesNotOverflow() {
        BackoffCalculator calculator = new BackoffCalculator(100, 2000, 0.0);

        assertThat(calculator.delayFor(Integer.MAX_VALUE)).isEqualTo(2000);
        assertThat(calculator.delayFor(64)).isEqualTo(2000);
    }

    @Test
    void invalidArguments_areRejected() {
        assertThatThrownBy(() -> new BackoffCalculator(0, 100, 0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("baseDelayMs must be positive");
        assertThatThrownBy(() -> new BackoffCalculator(100, 50, 0.1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(100, 200, 1.5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(100, 200, 0.1).delayFor(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
