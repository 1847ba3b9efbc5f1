package com.ryuqq.provisioner.core.event;

import com.ryuqq.provisioner.core.model.MachineId;
import com.ryuqq.provisioner.core.model.RequestId;

import java.time.Instant;

/**
 * 백엔드가 새 리소스를 보고하여 Machine이 생성됨.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record MachineRegistered(
    String eventId,
    MachineId machineId,
    Instant occurredAt,
    RequestId requestId,
    String resourceId,
    String strategyName
) implements MachineEvent {

    public MachineRegistered {
        EventHeaders.require(eventId, machineId, occurredAt);
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceId cannot be null or blank");
        }
        if (strategyName == null || strategyName.isBlank()) {
            throw new IllegalArgumentException("strategyName cannot be null or blank");
        }
    }
}
