package com.ryuqq.provisioner.core.event;

import java.time.Instant;

/**
 * 불변 도메인 이벤트.
 *
 * <p>모든 상태 전이는 Aggregate 로그에 추가되는 이벤트로 표현되며, 현재 상태는
 * 로그의 left-fold입니다. eventId는 안정적인 식별자로, 크래시 후 재실행 시 같은 이벤트가
 * 두 번 적용되지 않도록 중복 제거에 사용됩니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface DomainEvent {

    String eventId();

    String aggregateId();

    Instant occurredAt();
}
