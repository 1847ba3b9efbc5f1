package com.ryuqq.provisioner.adapter.inmemory.store;

import com.ryuqq.provisioner.core.event.DomainEvent;
import com.ryuqq.provisioner.core.exception.ConcurrencyConflictException;
import com.ryuqq.provisioner.core.spi.EventStore;
import com.ryuqq.provisioner.core.spi.StoredSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 테스트와 단일 프로세스용 {@link EventStore} 인메모리 구현체.
 *
 * <p><strong>자료 구조:</strong></p>
 * <ul>
 *   <li><strong>streams:</strong> ConcurrentHashMap&lt;String, Stream&gt; - aggregate당 append-only 로그 하나 (O(1) 조회)</li>
 *   <li><strong>Stream.eventIds:</strong> 이미 저장된 이벤트 ID (중복 제거용)</li>
 *   <li><strong>Stream.sequence:</strong> 최초 기록 순서 ({@link #aggregateIds()} 순서 유지용)</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> append는 대상 스트림만 잠그므로 서로 다른 aggregate의 기록은 경합하지 않습니다.
 * 버전 확인과 기록은 같은 락 안에서 일어납니다.</p>
 *
 * <p><strong>제약사항:</strong></p>
 * <ul>
 *   <li>프로세스 재시작 시 데이터 소실</li>
 *   <li>스냅샷은 참조로 보관 (aggregate가 불변이므로)</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param <E> 이벤트 타입
 * @param <S> 스냅샷 타입
 */
public class InMemoryEventStore<E extends DomainEvent, S> implements EventStore<E, S> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ConcurrentHashMap<String, Stream<E, S>> streams = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public long append(String aggregateId, long expectedVersion, List<? extends E> events, S snapshot) {
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId cannot be null");
        }
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be null or empty");
        }
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }

        Stream<E, S> stream = streams.computeIfAbsent(aggregateId, id -> new Stream<>(sequence.incrementAndGet()));
        synchronized (stream) {
            List<E> fresh = events.stream()
                .filter(e -> !stream.eventIds.contains(e.eventId()))
                .collect(Collectors.toList());
            long current = stream.events.size();
            if (fresh.isEmpty()) {
                log.debug("All {} events already stored for {}, append is a no-op", events.size(), aggregateId);
                return current;
            }
            long duplicates = events.size() - fresh.size();
            if (current != expectedVersion + duplicates) {
                throw new ConcurrencyConflictException(aggregateId, expectedVersion, current);
            }
            for (E event : fresh) {
                stream.events.add(event);
                stream.eventIds.add(event.eventId());
            }
            stream.snapshot = snapshot;
            return stream.events.size();
        }
    }

    @Override
    public List<E> loadEvents(String aggregateId) {
        Stream<E, S> stream = streams.get(aggregateId);
        if (stream == null) {
            return List.of();
        }
        synchronized (stream) {
            return List.copyOf(stream.events);
        }
    }

    @Override
    public Optional<StoredSnapshot<S>> loadSnapshot(String aggregateId) {
        Stream<E, S> stream = streams.get(aggregateId);
        if (stream == null) {
            return Optional.empty();
        }
        synchronized (stream) {
            if (stream.snapshot == null) {
                return Optional.empty();
            }
            return Optional.of(new StoredSnapshot<>(stream.snapshot, stream.events.size()));
        }
    }

    @Override
    public List<String> aggregateIds() {
        return streams.entrySet().stream()
            .filter(e -> !e.getValue().archived && e.getValue().snapshot != null)
            .sorted(Comparator.comparingLong(e -> e.getValue().sequence))
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }

    @Override
    public boolean archive(String aggregateId) {
        Stream<E, S> stream = streams.get(aggregateId);
        if (stream == null) {
            return false;
        }
        synchronized (stream) {
            if (stream.archived || stream.snapshot == null) {
                return false;
            }
            stream.archived = true;
            return true;
        }
    }

    /**
     * 모든 스트림 삭제 (테스트 전용).
     */
    public void clear() {
        streams.clear();
    }

    private static final class Stream<E, S> {

        private final long sequence;
        private final List<E> events = new ArrayList<>();
        private final Set<String> eventIds = new HashSet<>();
        private volatile S snapshot;
        private volatile boolean archived;

        private Stream(long sequence) {
            this.sequence = sequence;
        }
    }
}
