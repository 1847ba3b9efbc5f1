package com.ryuqq.provisioner.core.model;

/**
 * 클라우드 관점의 머신 상태.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum MachineStatus {

    PENDING("pending"),
    RUNNING("running"),
    STOPPING("stopping"),
    TERMINATED("terminated"),
    FAILED("failed");

    private final String wireValue;

    MachineStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    /**
     * 더 이상 변하지 않는 상태인지 확인.
     *
     * @return TERMINATED 또는 FAILED이면 true
     */
    public boolean isTerminal() {
        return this == TERMINATED || this == FAILED;
    }
}
