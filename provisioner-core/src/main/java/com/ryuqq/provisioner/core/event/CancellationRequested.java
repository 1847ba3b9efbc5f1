package com.ryuqq.provisioner.core.event;

import com.ryuqq.provisioner.core.model.RequestId;

import java.time.Instant;

/**
 * 취소 표시. 다음 reconcile 패스가 관측하여 처리합니다.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record CancellationRequested(
    String eventId,
    RequestId requestId,
    Instant occurredAt,
    String reason
) implements RequestEvent {

    public CancellationRequested {
        EventHeaders.require(eventId, requestId, occurredAt);
    }
}
