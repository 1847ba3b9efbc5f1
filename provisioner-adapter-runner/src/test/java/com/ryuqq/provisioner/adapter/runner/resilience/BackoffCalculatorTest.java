package com.ryuqq.provisioner.adapter.runner.resilience;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffCalculatorTest {

    @Test
    void 시도마다_지연이_multiplier배로_늘어난다() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(new RetryPolicy(5, 200, 2.0, 5000));

        // when & then
        assertThat(calculator.calculate(1)).isEqualTo(200);
        assertThat(calculator.calculate(2)).isEqualTo(400);
        assertThat(calculator.calculate(3)).isEqualTo(800);
        assertThat(calculator.calculate(4)).isEqualTo(1600);
    }

    @Test
    void 지연은_maxDelay를_넘지_않는다() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(new RetryPolicy(10, 1000, 3.0, 5000));

        // when & then
        assertThat(calculator.calculate(3)).isEqualTo(5000);
        assertThat(calculator.calculate(60)).isEqualTo(5000);
    }

    @Test
    void 대기_시간은_직전_대기_시간에_multiplier를_곱한_값_이상이다() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(new RetryPolicy(6, 150, 1.5, 100000));

        // when & then
        for (int attempt = 2; attempt <= 6; attempt++) {
            long previous = calculator.calculate(attempt - 1);
            assertThat(calculator.calculate(attempt)).isGreaterThanOrEqualTo((long) (previous * 1.5) - 1);
        }
    }

    @Test
    void 정책이_null이면_예외가_발생한다() {
        assertThatThrownBy(() -> new BackoffCalculator(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("policy cannot be null");
    }

    @Test
    void 시도_횟수가_양수가_아니면_예외가_발생한다() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(new RetryPolicy());

        // when & then
        assertThatThrownBy(() -> calculator.calculate(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attemptCount must be positive");
    }
}
