package com.ryuqq.provisioner.core.repository;

import com.ryuqq.provisioner.core.event.DomainEvent;
import com.ryuqq.provisioner.core.exception.AggregateNotFoundException;
import com.ryuqq.provisioner.core.exception.ConcurrencyConflictException;
import com.ryuqq.provisioner.core.spi.EventStore;
import com.ryuqq.provisioner.core.spi.StoredSnapshot;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * 이벤트 소싱 저장소.
 *
 * <p>Aggregate의 상태 전이를 append-only 이벤트 로그와 현재 상태 스냅샷으로 영속화합니다.
 * 모든 쓰기는 {@link EventStore}의 낙관적 동시성 검사를 거치므로, 같은 버전에 대한
 * 동시 쓰기 중 정확히 하나만 성공합니다.</p>
 *
 * <p><strong>2단계 쓰기:</strong></p>
 * <ol>
 *   <li>Aggregate의 {@code propose*} 메서드가 이벤트를 결정 (순수 함수)</li>
 *   <li>{@link #appendEvents(String, List, long)} 또는 {@link #save(Object, long)}가 기록 (부수 효과)</li>
 * </ol>
 *
 * <p>충돌 시 {@link #update(String, int, Function)}가 다시 읽고 결정을 재적용합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param <A> Aggregate 타입
 * @param <E> 이벤트 타입
 */
public class EventSourcedRepository<A, E extends DomainEvent> {

    private final EventStore<E, A> store;
    private final AggregateType<A, E> type;

    public EventSourcedRepository(EventStore<E, A> store, AggregateType<A, E> type) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        this.store = store;
        this.type = type;
    }

    /**
     * Aggregate의 pending 이벤트 저장.
     *
     * @param aggregate pending 이벤트를 가진 Aggregate
     * @param expectedVersion 호출자가 읽은 버전
     * @return 새 버전 (pending 이벤트가 없으면 expectedVersion)
     * @throws ConcurrencyConflictException 저장된 버전이 expectedVersion과 다른 경우
     * @throws IllegalArgumentException Aggregate의 기준 버전과 expectedVersion이 다른 경우
     */
    public long save(A aggregate, long expectedVersion) {
        if (aggregate == null) {
            throw new IllegalArgumentException("aggregate cannot be null");
        }
        List<E> pending = type.pendingEventsOf(aggregate);
        if (pending.isEmpty()) {
            return expectedVersion;
        }
        long base = type.versionOf(aggregate) - pending.size();
        if (base != expectedVersion) {
            throw new IllegalArgumentException(String.format(
                "expectedVersion %d does not match the version the aggregate was loaded at (%d)",
                expectedVersion, base));
        }
        return store.append(type.idOf(aggregate), expectedVersion, pending, type.markCommitted(aggregate));
    }

    /**
     * 이벤트 추가 후 새 상태 반환.
     *
     * @param aggregateId Aggregate ID
     * @param events 추가할 이벤트
     * @param expectedVersion 호출자가 읽은 버전 (신규는 0)
     * @return 이벤트가 반영된 상태
     * @throws ConcurrencyConflictException 버전 불일치
     */
    public A appendEvents(String aggregateId, List<? extends E> events, long expectedVersion) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be null or empty");
        }
        A next;
        if (expectedVersion == 0) {
            next = type.replay(events);
        } else {
            A current = find(aggregateId).orElseThrow(() -> new ConcurrencyConflictException(aggregateId, expectedVersion, 0));
            long actual = type.versionOf(current);
            if (actual != expectedVersion) {
                throw new ConcurrencyConflictException(aggregateId, expectedVersion, actual);
            }
            next = type.applyAll(current, events);
        }
        long stored = store.append(aggregateId, expectedVersion, events, next);
        // 전부 중복이면 store는 no-op으로 현재 버전을 돌려준다
        return stored == type.versionOf(next) ? next : load(aggregateId);
    }

    /**
     * 충돌 시 다시 읽고 결정을 재적용하는 갱신.
     *
     * @param aggregateId Aggregate ID
     * @param maxAttempts 최대 시도 횟수
     * @param decide 현재 상태로부터 이벤트를 결정하는 순수 함수
     * @return 갱신된 상태 (결정된 이벤트가 없으면 현재 상태)
     * @throws ConcurrencyConflictException maxAttempts 동안 계속 충돌한 경우
     * @throws AggregateNotFoundException Aggregate가 없는 경우
     */
    public A update(String aggregateId, int maxAttempts, Function<A, List<? extends E>> decide) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        ConcurrencyConflictException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            A current = load(aggregateId);
            List<? extends E> events = decide.apply(current);
            if (events.isEmpty()) {
                return current;
            }
            try {
                return appendEvents(aggregateId, events, type.versionOf(current));
            } catch (ConcurrencyConflictException e) {
                last = e;
            }
        }
        throw last;
    }

    /**
     * Aggregate 로드.
     *
     * @throws AggregateNotFoundException 존재하지 않는 경우
     */
    public A load(String aggregateId) {
        return find(aggregateId).orElseThrow(() ->
            new AggregateNotFoundException(type.name() + " not found: " + aggregateId));
    }

    /**
     * Aggregate 조회. 스냅샷이 있으면 사용하고, 없으면 이벤트 로그를 재생합니다.
     */
    public Optional<A> find(String aggregateId) {
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId cannot be null");
        }
        Optional<StoredSnapshot<A>> snapshot = store.loadSnapshot(aggregateId);
        if (snapshot.isPresent()) {
            return Optional.of(snapshot.get().snapshot());
        }
        List<E> events = store.loadEvents(aggregateId);
        if (events.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(type.replay(events));
    }

    public List<E> loadEvents(String aggregateId) {
        return store.loadEvents(aggregateId);
    }

    /**
     * 활성 Aggregate 전체 ID.
     */
    public List<String> ids() {
        return store.aggregateIds();
    }

    /**
     * 보관 처리 (활성 인덱스에서 제외, 물리 삭제 없음).
     */
    public boolean archive(String aggregateId) {
        return store.archive(aggregateId);
    }

    public AggregateType<A, E> type() {
        return type;
    }
}
