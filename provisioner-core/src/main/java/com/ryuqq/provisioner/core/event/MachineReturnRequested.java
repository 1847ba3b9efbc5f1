package com.ryuqq.provisioner.core.event;

import com.ryuqq.provisioner.core.model.MachineId;
import com.ryuqq.provisioner.core.model.RequestId;

import java.time.Instant;

/**
 * 머신이 반환 요청의 대상이 됨.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record MachineReturnRequested(
    String eventId,
    MachineId machineId,
    Instant occurredAt,
    RequestId returnRequestId
) implements MachineEvent {

    public MachineReturnRequested {
        EventHeaders.require(eventId, machineId, occurredAt);
        if (returnRequestId == null) {
            throw new IllegalArgumentException("returnRequestId cannot be null");
        }
    }
}
