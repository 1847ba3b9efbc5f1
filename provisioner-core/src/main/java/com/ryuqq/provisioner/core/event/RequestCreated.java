package com.ryuqq.provisioner.core.event;

import com.ryuqq.provisioner.core.model.MachineId;
import com.ryuqq.provisioner.core.model.RequestId;
import com.ryuqq.provisioner.core.model.RequestType;
import com.ryuqq.provisioner.core.model.TemplateId;

import java.time.Instant;
import java.util.List;

/**
 * Request 생성 (status = pending).
 *
 * <p>반환 요청은 templateId가 없고 machineIds에 대상 머신을 가집니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record RequestCreated(
    String eventId,
    RequestId requestId,
    Instant occurredAt,
    RequestType requestType,
    TemplateId templateId,
    int requestedCount,
    List<MachineId> machineIds
) implements RequestEvent {

    public RequestCreated {
        EventHeaders.require(eventId, requestId, occurredAt);
        if (requestType == null) {
            throw new IllegalArgumentException("requestType cannot be null");
        }
        if (requestedCount <= 0) {
            throw new IllegalArgumentException("requestedCount must be positive (current: " + requestedCount + ")");
        }
        machineIds = machineIds == null ? List.of() : List.copyOf(machineIds);
    }
}
