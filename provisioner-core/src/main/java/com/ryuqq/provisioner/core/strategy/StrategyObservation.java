package com.ryuqq.provisioner.core.strategy;

import com.ryuqq.provisioner.core.spi.HealthState;

/**
 * 선택 시점의 전략 건강/지표 스냅샷.
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param health 건강 상태
 * @param successRate 관측된 성공률 (0.0 ~ 1.0)
 * @param averageLatencyMs 관측된 평균 응답 시간
 * @param sampleCount 관측 건수 (0이면 지표 미확보)
 */
public record StrategyObservation(
    HealthState health,
    double successRate,
    double averageLatencyMs,
    long sampleCount
) {

    /** 관측 기록이 없는 전략의 기본값. */
    public static final StrategyObservation UNOBSERVED = new StrategyObservation(HealthState.HEALTHY, 1.0, 0.0, 0);

    public StrategyObservation {
        if (health == null) {
            throw new IllegalArgumentException("health cannot be null");
        }
        if (successRate < 0.0 || successRate > 1.0) {
            throw new IllegalArgumentException("successRate must be between 0.0 and 1.0 (current: " + successRate + ")");
        }
        if (averageLatencyMs < 0) {
            throw new IllegalArgumentException("averageLatencyMs cannot be negative (current: " + averageLatencyMs + ")");
        }
    }
}
