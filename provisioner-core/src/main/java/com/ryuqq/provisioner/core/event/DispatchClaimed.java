package com.ryuqq.provisioner.core.event;

import com.ryuqq.provisioner.core.model.RequestId;

import java.time.Instant;

/**
 * dispatch 선점 기록 (status는 pending 유지).
 *
 * <p>백엔드 호출 전에 기록되므로, 동시에 dispatch를 시도한 두 워커 중 낙관적 쓰기에서
 * 이긴 쪽만 백엔드를 호출합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record DispatchClaimed(
    String eventId,
    RequestId requestId,
    Instant occurredAt
) implements RequestEvent {

    public DispatchClaimed {
        EventHeaders.require(eventId, requestId, occurredAt);
    }
}
