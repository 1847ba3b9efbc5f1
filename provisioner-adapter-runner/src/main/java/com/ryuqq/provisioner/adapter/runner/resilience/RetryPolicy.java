package com.ryuqq.provisioner.adapter.runner.resilience;

/**
 * 백엔드 호출 재시도 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최초 호출을 포함한 최대 시도 횟수 (기본 3)</li>
 *   <li>initialDelayMs: 첫 재시도 전 대기 시간 (기본 200ms)</li>
 *   <li>multiplier: 재시도마다 곱해지는 배수 (기본 2.0)</li>
 *   <li>maxDelayMs: 대기 시간 상한 (기본 5000ms)</li>
 * </ul>
 *
 * <p>일시적 오류로 분류된 실패만 재시도합니다. 영구 오류는 첫 시도에서 바로 전달됩니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param initialDelayMs 첫 재시도 대기 시간 (밀리초, 0 이상)
 * @param multiplier 지수 배수 (1.0 이상)
 * @param maxDelayMs 최대 대기 시간 (밀리초, initialDelayMs 이상)
 */
public record RetryPolicy(
    int maxAttempts,
    long initialDelayMs,
    double multiplier,
    long maxDelayMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, initialDelayMs=200ms, multiplier=2.0, maxDelayMs=5000ms</p>
     */
    public RetryPolicy() {
        this(3, 200, 2.0, 5000);
    }

    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException(
                "initialDelayMs cannot be negative (current: " + initialDelayMs + ")"
            );
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException(
                "multiplier must be >= 1.0 (current: " + multiplier + ")"
            );
        }
        if (maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= initialDelayMs (initial: " + initialDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
    }

    /**
     * 재시도 없이 한 번만 호출하는 정책.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, 0, 1.0, 0);
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, initialDelayMs, multiplier, maxDelayMs);
    }

    public RetryPolicy withInitialDelayMs(long initialDelayMs) {
        return new RetryPolicy(maxAttempts, initialDelayMs, multiplier, maxDelayMs);
    }

    public RetryPolicy withMultiplier(double multiplier) {
        return new RetryPolicy(maxAttempts, initialDelayMs, multiplier, maxDelayMs);
    }

    public RetryPolicy withMaxDelayMs(long maxDelayMs) {
        return new RetryPolicy(maxAttempts, initialDelayMs, multiplier, maxDelayMs);
    }
}
