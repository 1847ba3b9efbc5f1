package com.ryuqq.provisioner.core.event;

import com.ryuqq.provisioner.core.model.BackendBinding;
import com.ryuqq.provisioner.core.model.RequestId;

import java.time.Instant;
import java.util.List;

/**
 * 백엔드 호출 성공 (status = running), 핸들 기록.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record RequestDispatched(
    String eventId,
    RequestId requestId,
    Instant occurredAt,
    List<BackendBinding> bindings
) implements RequestEvent {

    public RequestDispatched {
        EventHeaders.require(eventId, requestId, occurredAt);
        if (bindings == null || bindings.isEmpty()) {
            throw new IllegalArgumentException("bindings cannot be null or empty");
        }
        bindings = List.copyOf(bindings);
    }
}
