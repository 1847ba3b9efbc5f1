package com.ryuqq.provisioner.core.event;

import com.ryuqq.provisioner.core.model.MachineId;
import com.ryuqq.provisioner.core.model.MachineResult;

import java.time.Instant;

/**
 * 결과 플래그 확정 (executing → succeed | fail, 한 번만).
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record MachineResultSettled(
    String eventId,
    MachineId machineId,
    Instant occurredAt,
    MachineResult result
) implements MachineEvent {

    public MachineResultSettled {
        EventHeaders.require(eventId, machineId, occurredAt);
        if (result == null || !result.isSettled()) {
            throw new IllegalArgumentException("result must be settled (current: " + result + ")");
        }
    }
}
