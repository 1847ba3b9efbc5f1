package com.ryuqq.provisioner.core.event;

import com.ryuqq.provisioner.core.exception.ErrorKind;
import com.ryuqq.provisioner.core.model.RequestId;
import com.ryuqq.provisioner.core.model.RequestStatus;

import java.time.Instant;

/**
 * Request 종료 (completed, completed_with_error, failed).
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record RequestSettled(
    String eventId,
    RequestId requestId,
    Instant occurredAt,
    RequestStatus status,
    String message,
    ErrorKind errorKind
) implements RequestEvent {

    public RequestSettled {
        EventHeaders.require(eventId, requestId, occurredAt);
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("status must be terminal (current: " + status + ")");
        }
    }
}
