package com.ryuqq.provisioner.adapter.runner.runtime;

/**
 * Reaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 300000ms = 5분)</li>
 *   <li>staleDispatchThresholdMs: pending 상태 허용 시간 (기본 600000ms = 10분)</li>
 *   <li>retentionMs: 종료된 Request 보관 기간, 초과 시 보관 처리 (기본 7일)</li>
 *   <li>batchSize: 한 번에 처리할 항목 수 (기본 50)</li>
 *   <li>defaultStrategy: 선점되지 않은 오래된 Request 처리 전략 (기본 FAIL)</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param staleDispatchThresholdMs pending 허용 시간 (밀리초, 양수여야 함)
 * @param retentionMs 보관 기간 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param defaultStrategy 기본 리컨실 전략 (null이 아니어야 함)
 */
public record ReaperConfig(
    long scanIntervalMs,
    long staleDispatchThresholdMs,
    long retentionMs,
    int batchSize,
    ReconcileStrategy defaultStrategy
) {

    private static final long SEVEN_DAYS_MS = 7L * 24 * 60 * 60 * 1000;

    /**
     * 기본 설정 생성자.
     */
    public ReaperConfig() {
        this(300000, 600000, SEVEN_DAYS_MS, 50, ReconcileStrategy.FAIL);
    }

    public ReaperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (staleDispatchThresholdMs <= 0) {
            throw new IllegalArgumentException(
                "staleDispatchThresholdMs must be positive (current: " + staleDispatchThresholdMs + ")"
            );
        }
        if (retentionMs <= 0) {
            throw new IllegalArgumentException(
                "retentionMs must be positive (current: " + retentionMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (defaultStrategy == null) {
            throw new IllegalArgumentException("defaultStrategy cannot be null");
        }
    }

    public ReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new ReaperConfig(scanIntervalMs, staleDispatchThresholdMs, retentionMs, batchSize, defaultStrategy);
    }

    public ReaperConfig withStaleDispatchThresholdMs(long staleDispatchThresholdMs) {
        return new ReaperConfig(scanIntervalMs, staleDispatchThresholdMs, retentionMs, batchSize, defaultStrategy);
    }

    public ReaperConfig withRetentionMs(long retentionMs) {
        return new ReaperConfig(scanIntervalMs, staleDispatchThresholdMs, retentionMs, batchSize, defaultStrategy);
    }

    public ReaperConfig withBatchSize(int batchSize) {
        return new ReaperConfig(scanIntervalMs, staleDispatchThresholdMs, retentionMs, batchSize, defaultStrategy);
    }

    public ReaperConfig withDefaultStrategy(ReconcileStrategy defaultStrategy) {
        return new ReaperConfig(scanIntervalMs, staleDispatchThresholdMs, retentionMs, batchSize, defaultStrategy);
    }
}
