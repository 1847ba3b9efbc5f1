package com.ryuqq.provisioner.core.repository;

import com.ryuqq.provisioner.core.event.DomainEvent;

import java.util.List;

/**
 * 저장소가 Aggregate를 다루기 위해 필요한 연산 묶음.
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param <A> Aggregate 타입
 * @param <E> 이벤트 타입
 */
public interface AggregateType<A, E extends DomainEvent> {

    String name();

    String idOf(A aggregate);

    long versionOf(A aggregate);

    /**
     * 이벤트 로그를 left-fold하여 상태 복원.
     */
    A replay(List<? extends E> events);

    /**
     * 현재 상태에 이벤트를 순서대로 적용.
     */
    A applyAll(A aggregate, List<? extends E> events);

    List<E> pendingEventsOf(A aggregate);

    A markCommitted(A aggregate);
}
