package com.ryuqq.provisioner.core.event;

import com.ryuqq.provisioner.core.model.MachineId;
import com.ryuqq.provisioner.core.model.RequestId;

import java.time.Instant;
import java.util.List;

/**
 * reconcile 중 새로 보고된 머신을 Request에 연결.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record MachinesAttached(
    String eventId,
    RequestId requestId,
    Instant occurredAt,
    List<MachineId> machineIds
) implements RequestEvent {

    public MachinesAttached {
        EventHeaders.require(eventId, requestId, occurredAt);
        if (machineIds == null || machineIds.isEmpty()) {
            throw new IllegalArgumentException("machineIds cannot be null or empty");
        }
        machineIds = List.copyOf(machineIds);
    }
}
