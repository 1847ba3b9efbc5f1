package com.ryuqq.provisioner.adapter.runner.engine;

import com.ryuqq.provisioner.core.protection.BackendOperation;
import com.ryuqq.provisioner.core.protection.TimeoutPolicy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    @Test
    void 기본값() {
        EngineConfig config = new EngineConfig();

        assertThat(config.maxConflictRetries()).isEqualTo(5);
        assertThat(config.requestTimeoutMs()).isEqualTo(3_600_000);
        assertThat(config.fallbackToBaseAttributes()).isFalse();
        assertThat(config.backendPoolSize()).isEqualTo(8);
        assertThat(config.minSuccessRate()).isEqualTo(0.95);
        assertThat(config.maxResponseTimeMs()).isEqualTo(5000);
    }

    @Test
    void 작업별_타임아웃_정책을_만든다() {
        // given
        EngineConfig config = new EngineConfig().withTimeouts(1000, 2000, 3000);

        // when
        TimeoutPolicy policy = config.timeoutPolicy();

        // then
        assertThat(policy.getPerAttemptTimeoutMs(BackendOperation.PROVISION)).isEqualTo(1000);
        assertThat(policy.getPerAttemptTimeoutMs(BackendOperation.POLL)).isEqualTo(2000);
        assertThat(policy.getPerAttemptTimeoutMs(BackendOperation.TERMINATE)).isEqualTo(3000);
    }

    @Test
    void 잘못된_값은_거부한다() {
        assertThatThrownBy(() -> new EngineConfig().withMaxConflictRetries(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("maxConflictRetries must be positive (current: 0)");
        assertThatThrownBy(() -> new EngineConfig().withRequestTimeoutMs(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EngineConfig().withReturnGracePeriodSeconds(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EngineConfig().withSelectionThresholds(1.5, 5000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("minSuccessRate must be between 0.0 and 1.0 (current: 1.5)");
        assertThatThrownBy(() -> new EngineConfig().withSelectionThresholds(0.9, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("maxResponseTimeMs must be positive (current: 0)");
    }

    @Test
    void with_메서드는_나머지_값을_유지한다() {
        EngineConfig config = new EngineConfig().withFallbackToBaseAttributes(true).withBackendPoolSize(2);

        assertThat(config.fallbackToBaseAttributes()).isTrue();
        assertThat(config.backendPoolSize()).isEqualTo(2);
        assertThat(config.maxConflictRetries()).isEqualTo(5);
    }
}
