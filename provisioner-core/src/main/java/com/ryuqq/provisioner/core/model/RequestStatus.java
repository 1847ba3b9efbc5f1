package com.ryuqq.provisioner.core.model;

/**
 * Request 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * PENDING ──► RUNNING ──► COMPLETED
 *    │           ├──────► COMPLETED_WITH_ERROR
 *    │           └──────► FAILED
 *    └──────────────────► FAILED
 * </pre>
 *
 * <p>종료 상태(COMPLETED, COMPLETED_WITH_ERROR, FAILED)에서는 더 이상 전이할 수 없습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum RequestStatus {

    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    COMPLETED_WITH_ERROR("completed_with_error"),
    FAILED("failed");

    private final String wireValue;

    RequestStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * 외부 인터페이스(JSON 응답)에 사용되는 값.
     *
     * @return 소문자 상태 문자열
     */
    public String getWireValue() {
        return wireValue;
    }

    /**
     * 종료 상태 여부 확인.
     *
     * @return 종료 상태이면 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == COMPLETED_WITH_ERROR || this == FAILED;
    }
}
