package com.ryuqq.provisioner.core.protection;

/**
 * Circuit Breaker SPI.
 *
 * <p>전략(백엔드) 하나당 인스턴스 하나를 두고, 그 전략을 호출하는 모든 동시 호출자가
 * 상태를 공유합니다. 상태 전이는 원자적으로(compare-and-swap) 일어나야 하며,
 * 두 호출자가 서로 다르게 OPEN/CLOSED로 전이시키는 일이 없어야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * if (!cb.tryAcquire()) {
 *     throw new CircuitOpenException(strategyName);
 * }
 * try {
 *     ProvisioningHandle handle = backend.provision(spec, count);
 *     cb.recordSuccess();
 *     return handle;
 * } catch (RuntimeException e) {
 *     cb.recordFailure(e);
 *     throw e;
 * }
 * }</pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 호출 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 true</li>
     *   <li>OPEN: recoveryTimeout이 지나지 않았으면 false, 지났으면 HALF_OPEN으로 전이 후 시험 허가 확보</li>
     *   <li>HALF_OPEN: 남은 시험 허가가 있을 때만 true</li>
     * </ul>
     *
     * @return true: 호출 허용, false: 즉시 실패해야 함
     */
    boolean tryAcquire();

    /**
     * 호출 성공 기록.
     */
    void recordSuccess();

    /**
     * 호출 실패 기록.
     *
     * @param throwable 발생한 예외
     */
    void recordFailure(Throwable throwable);

    /**
     * 현재 상태 조회.
     *
     * <p>recoveryTimeout이 지나 시험 호출을 받을 수 있는 OPEN은 HALF_OPEN으로 보고해야 합니다.
     * 전략 선택은 이 값으로 후보를 거르므로, OPEN으로 남겨 두면 시험 호출이 영영 오지 않습니다.</p>
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * CLOSED 상태로 강제 리셋 (수동 복구 또는 테스트용).
     */
    void reset();
}
