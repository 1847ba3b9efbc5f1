package com.ryuqq.provisioner.core.exception;

/**
 * Circuit Breaker가 OPEN 상태라 백엔드를 호출하지 않고 즉시 실패함.
 *
 * <p>영구 실패와 구분되는 "백엔드 일시적 사용 불가" 신호입니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class CircuitOpenException extends ProvisioningException {

    private final String strategyName;

    public CircuitOpenException(String strategyName) {
        super(ErrorKind.BACKEND_UNAVAILABLE,
            "Backend temporarily unavailable: circuit open for strategy " + strategyName);
        this.strategyName = strategyName;
    }

    public String getStrategyName() {
        return strategyName;
    }
}
