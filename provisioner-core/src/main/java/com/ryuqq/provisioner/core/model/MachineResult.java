package com.ryuqq.provisioner.core.model;

/**
 * 요청 관점의 머신 처리 결과.
 *
 * <p>EXECUTING에서 SUCCEED 또는 FAIL로 단 한 번만 이동합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum MachineResult {

    EXECUTING("executing"),
    SUCCEED("succeed"),
    FAIL("fail");

    private final String wireValue;

    MachineResult(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    public boolean isSettled() {
        return this != EXECUTING;
    }
}
