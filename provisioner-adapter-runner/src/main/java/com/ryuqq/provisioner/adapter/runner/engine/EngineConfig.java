package com.ryuqq.provisioner.adapter.runner.engine;

import com.ryuqq.provisioner.adapter.runner.resilience.OperationTimeoutPolicy;

/**
 * 프로비저닝 엔진 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxConflictRetries: 동시성 충돌 시 다시 읽고 재적용하는 최대 횟수 (기본 5)</li>
 *   <li>dispatchTimeoutMs: provision 호출 1회 타임아웃 (기본 30000ms)</li>
 *   <li>pollTimeoutMs: pollStatus 호출 1회 타임아웃 (기본 10000ms)</li>
 *   <li>terminateTimeoutMs: terminate 호출 1회 타임아웃 (기본 30000ms)</li>
 *   <li>requestTimeoutMs: running 상태 허용 시간, 초과 시 completed_with_error (기본 3600000ms = 1시간)</li>
 *   <li>fallbackToBaseAttributes: 템플릿 렌더링 실패 시 기본 속성만으로 진행할지 여부 (기본 false)</li>
 *   <li>returnGracePeriodSeconds: 반환 요청 목록에 표시할 유예 시간 (기본 0초)</li>
 *   <li>backendPoolSize: 동시에 진행할 수 있는 백엔드 호출 수 (기본 8)</li>
 *   <li>minSuccessRate: 이 성공률 이상인 전략을 우선 선택 (기본 0.95)</li>
 *   <li>maxResponseTimeMs: 평균 응답 시간이 이 값 이하인 전략을 우선 선택 (기본 5000ms)</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param maxConflictRetries 충돌 재시도 횟수 (1 이상)
 * @param dispatchTimeoutMs provision 타임아웃 (밀리초, 0이면 제한 없음)
 * @param pollTimeoutMs poll 타임아웃 (밀리초, 0이면 제한 없음)
 * @param terminateTimeoutMs terminate 타임아웃 (밀리초, 0이면 제한 없음)
 * @param requestTimeoutMs Request 전체 타임아웃 (밀리초, 양수)
 * @param fallbackToBaseAttributes 렌더링 실패 시 기본 속성 사용 여부
 * @param returnGracePeriodSeconds 반환 유예 시간 (초, 0 이상)
 * @param backendPoolSize 백엔드 호출 풀 크기 (1 이상)
 * @param minSuccessRate 선택 우대 성공률 (0.0 ~ 1.0)
 * @param maxResponseTimeMs 선택 우대 평균 응답 시간 (밀리초, 양수)
 */
public record EngineConfig(
    int maxConflictRetries,
    long dispatchTimeoutMs,
    long pollTimeoutMs,
    long terminateTimeoutMs,
    long requestTimeoutMs,
    boolean fallbackToBaseAttributes,
    long returnGracePeriodSeconds,
    int backendPoolSize,
    double minSuccessRate,
    long maxResponseTimeMs
) {

    /**
     * 기본 설정 생성자.
     */
    public EngineConfig() {
        this(5, 30000, 10000, 30000, 3600000, false, 0, 8, 0.95, 5000);
    }

    public EngineConfig {
        if (maxConflictRetries <= 0) {
            throw new IllegalArgumentException(
                "maxConflictRetries must be positive (current: " + maxConflictRetries + ")"
            );
        }
        if (dispatchTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "dispatchTimeoutMs cannot be negative (current: " + dispatchTimeoutMs + ")"
            );
        }
        if (pollTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "pollTimeoutMs cannot be negative (current: " + pollTimeoutMs + ")"
            );
        }
        if (terminateTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "terminateTimeoutMs cannot be negative (current: " + terminateTimeoutMs + ")"
            );
        }
        if (requestTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "requestTimeoutMs must be positive (current: " + requestTimeoutMs + ")"
            );
        }
        if (returnGracePeriodSeconds < 0) {
            throw new IllegalArgumentException(
                "returnGracePeriodSeconds cannot be negative (current: " + returnGracePeriodSeconds + ")"
            );
        }
        if (backendPoolSize <= 0) {
            throw new IllegalArgumentException(
                "backendPoolSize must be positive (current: " + backendPoolSize + ")"
            );
        }
        if (minSuccessRate < 0.0 || minSuccessRate > 1.0) {
            throw new IllegalArgumentException(
                "minSuccessRate must be between 0.0 and 1.0 (current: " + minSuccessRate + ")"
            );
        }
        if (maxResponseTimeMs <= 0) {
            throw new IllegalArgumentException(
                "maxResponseTimeMs must be positive (current: " + maxResponseTimeMs + ")"
            );
        }
    }

    /**
     * 작업별 타임아웃 정책 생성.
     */
    public OperationTimeoutPolicy timeoutPolicy() {
        return new OperationTimeoutPolicy(dispatchTimeoutMs, pollTimeoutMs, terminateTimeoutMs);
    }

    public EngineConfig withMaxConflictRetries(int maxConflictRetries) {
        return new EngineConfig(maxConflictRetries, dispatchTimeoutMs, pollTimeoutMs, terminateTimeoutMs,
            requestTimeoutMs, fallbackToBaseAttributes, returnGracePeriodSeconds, backendPoolSize,
            minSuccessRate, maxResponseTimeMs);
    }

    public EngineConfig withTimeouts(long dispatchTimeoutMs, long pollTimeoutMs, long terminateTimeoutMs) {
        return new EngineConfig(maxConflictRetries, dispatchTimeoutMs, pollTimeoutMs, terminateTimeoutMs,
            requestTimeoutMs, fallbackToBaseAttributes, returnGracePeriodSeconds, backendPoolSize,
            minSuccessRate, maxResponseTimeMs);
    }

    public EngineConfig withRequestTimeoutMs(long requestTimeoutMs) {
        return new EngineConfig(maxConflictRetries, dispatchTimeoutMs, pollTimeoutMs, terminateTimeoutMs,
            requestTimeoutMs, fallbackToBaseAttributes, returnGracePeriodSeconds, backendPoolSize,
            minSuccessRate, maxResponseTimeMs);
    }

    public EngineConfig withFallbackToBaseAttributes(boolean fallbackToBaseAttributes) {
        return new EngineConfig(maxConflictRetries, dispatchTimeoutMs, pollTimeoutMs, terminateTimeoutMs,
            requestTimeoutMs, fallbackToBaseAttributes, returnGracePeriodSeconds, backendPoolSize,
            minSuccessRate, maxResponseTimeMs);
    }

    public EngineConfig withReturnGracePeriodSeconds(long returnGracePeriodSeconds) {
        return new EngineConfig(maxConflictRetries, dispatchTimeoutMs, pollTimeoutMs, terminateTimeoutMs,
            requestTimeoutMs, fallbackToBaseAttributes, returnGracePeriodSeconds, backendPoolSize,
            minSuccessRate, maxResponseTimeMs);
    }

    public EngineConfig withBackendPoolSize(int backendPoolSize) {
        return new EngineConfig(maxConflictRetries, dispatchTimeoutMs, pollTimeoutMs, terminateTimeoutMs,
            requestTimeoutMs, fallbackToBaseAttributes, returnGracePeriodSeconds, backendPoolSize,
            minSuccessRate, maxResponseTimeMs);
    }

    public EngineConfig withSelectionThresholds(double minSuccessRate, long maxResponseTimeMs) {
        return new EngineConfig(maxConflictRetries, dispatchTimeoutMs, pollTimeoutMs, terminateTimeoutMs,
            requestTimeoutMs, fallbackToBaseAttributes, returnGracePeriodSeconds, backendPoolSize,
            minSuccessRate, maxResponseTimeMs);
    }
}
