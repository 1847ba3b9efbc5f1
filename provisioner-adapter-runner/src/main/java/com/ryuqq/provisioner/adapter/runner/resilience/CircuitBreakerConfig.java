package com.ryuqq.provisioner.adapter.runner.resilience;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureThreshold: CLOSED → OPEN 전환에 필요한 연속 실패 수 (기본 5)</li>
 *   <li>recoveryTimeoutMs: OPEN 유지 시간, 경과 후 HALF_OPEN 시험 호출 허용 (기본 30000ms)</li>
 *   <li>halfOpenMaxCalls: HALF_OPEN에서 허용하는 시험 호출 수 (기본 1)</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param failureThreshold 연속 실패 임계값 (1 이상)
 * @param recoveryTimeoutMs 복구 대기 시간 (밀리초, 양수)
 * @param halfOpenMaxCalls 시험 호출 수 (1 이상)
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    long recoveryTimeoutMs,
    int halfOpenMaxCalls
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureThreshold=5, recoveryTimeoutMs=30000ms, halfOpenMaxCalls=1</p>
     */
    public CircuitBreakerConfig() {
        this(5, 30000, 1);
    }

    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (recoveryTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "recoveryTimeoutMs must be positive (current: " + recoveryTimeoutMs + ")"
            );
        }
        if (halfOpenMaxCalls <= 0) {
            throw new IllegalArgumentException(
                "halfOpenMaxCalls must be positive (current: " + halfOpenMaxCalls + ")"
            );
        }
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeoutMs, halfOpenMaxCalls);
    }

    public CircuitBreakerConfig withRecoveryTimeoutMs(long recoveryTimeoutMs) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeoutMs, halfOpenMaxCalls);
    }

    public CircuitBreakerConfig withHalfOpenMaxCalls(int halfOpenMaxCalls) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeoutMs, halfOpenMaxCalls);
    }
}
