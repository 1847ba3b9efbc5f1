package com.ryuqq.provisioner.adapter.runner.runtime;

/**
 * Reconcile 런타임 설정 (불변 record).
 *
 * <ul>
 *   <li>pollIntervalMs: 같은 Request를 두 번 poll하는 기본 간격 (기본 10000ms)</li>
 *   <li>jitterFactor: poll 간격에 적용하는 상대 편차, 0이면 jitter 없음 (기본 0.2)</li>
 *   <li>batchSize: 한 주기에 처리하는 최대 Request 수 (기본 50)</li>
 *   <li>concurrency: 한 주기를 처리하는 워커 스레드 수 (기본 4)</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param pollIntervalMs poll 간격 (밀리초, 양수)
 * @param jitterFactor jitter 비율 (0.0 ~ 1.0)
 * @param batchSize 주기당 Request 수 (1 이상)
 * @param concurrency 워커 스레드 수 (1 이상)
 */
public record ReconcilerConfig(
    long pollIntervalMs,
    double jitterFactor,
    int batchSize,
    int concurrency
) {

    /**
     * 기본 설정 생성자.
     */
    public ReconcilerConfig() {
        this(10000, 0.2, 50, 4);
    }

    public ReconcilerConfig {
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalMs must be positive (current: " + pollIntervalMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
    }

    public ReconcilerConfig withPollIntervalMs(long pollIntervalMs) {
        return new ReconcilerConfig(pollIntervalMs, jitterFactor, batchSize, concurrency);
    }

    public ReconcilerConfig withJitterFactor(double jitterFactor) {
        return new ReconcilerConfig(pollIntervalMs, jitterFactor, batchSize, concurrency);
    }

    public ReconcilerConfig withBatchSize(int batchSize) {
        return new ReconcilerConfig(pollIntervalMs, jitterFactor, batchSize, concurrency);
    }

    public ReconcilerConfig withConcurrency(int concurrency) {
        return new ReconcilerConfig(pollIntervalMs, jitterFactor, batchSize, concurrency);
    }
}
