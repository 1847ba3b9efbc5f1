package com.ryuqq.provisioner.core.statemachine;

import com.ryuqq.provisioner.core.exception.InvalidMachineStateException;
import com.ryuqq.provisioner.core.model.MachineResult;
import com.ryuqq.provisioner.core.model.MachineStatus;

/**
 * Machine 결과 플래그 전이 검증 및 관측 상태로부터의 결과 도출.
 *
 * <p>결과 플래그는 EXECUTING → SUCCEED | FAIL로 단 한 번만 이동합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class MachineResultTransition {

    private MachineResultTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 결과 플래그 전이 검증.
     *
     * @param from 현재 결과
     * @param to 새 결과
     * @throws InvalidMachineStateException 이미 확정되었거나 EXECUTING으로 되돌리려는 경우
     */
    public static void validate(MachineResult from, MachineResult to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Results cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isSettled()) {
            throw new InvalidMachineStateException(
                String.format("Result already settled: %s → %s", from, to));
        }
        if (!to.isSettled()) {
            throw new InvalidMachineStateException(
                String.format("Invalid result transition: %s → %s", from, to));
        }
    }

    /**
     * 관측된 클라우드 상태가 결과를 확정하는지 판단.
     *
     * <ul>
     *   <li>RUNNING → SUCCEED</li>
     *   <li>STOPPING, TERMINATED, FAILED (running에 도달하기 전) → FAIL</li>
     *   <li>PENDING → 미확정 (EXECUTING 유지)</li>
     * </ul>
     *
     * @param status 관측된 상태
     * @return 확정 결과, 아직 미확정이면 EXECUTING
     */
    public static MachineResult resultFor(MachineStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        return switch (status) {
            case RUNNING -> MachineResult.SUCCEED;
            case STOPPING, TERMINATED, FAILED -> MachineResult.FAIL;
            case PENDING -> MachineResult.EXECUTING;
        };
    }
}
