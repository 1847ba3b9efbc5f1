package com.ryuqq.provisioner.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 failureThreshold회)
 * OPEN (차단)
 *   │
 *   ▼ (recoveryTimeout 경과)
 * HALF_OPEN (반개방, halfOpenMaxCalls회 시험 호출)
 *   │
 *   ├─► 시험 호출 모두 성공 → CLOSED
 *   └─► 하나라도 실패 → OPEN
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과, 연속 실패 추적).
     */
    CLOSED,

    /**
     * 차단 상태 (백엔드를 호출하지 않고 즉시 실패).
     */
    OPEN,

    /**
     * 반개방 상태 (제한된 수의 시험 호출만 통과).
     */
    HALF_OPEN
}
