package com.ryuqq.provisioner.core.event;

import com.ryuqq.provisioner.core.model.MachineId;
import com.ryuqq.provisioner.core.model.MachineStatus;

import java.time.Instant;

/**
 * poll 결과 관측. occurredAt이 Machine의 lastObservedAt이 됩니다.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record MachineObserved(
    String eventId,
    MachineId machineId,
    Instant occurredAt,
    MachineStatus status,
    String name,
    String privateIpAddress,
    String publicIpAddress,
    Instant launchTime,
    String message
) implements MachineEvent {

    public MachineObserved {
        EventHeaders.require(eventId, machineId, occurredAt);
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }
}
