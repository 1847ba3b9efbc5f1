package com.ryuqq.provisioner.core.repository;

import com.ryuqq.provisioner.core.event.RequestEvent;
import com.ryuqq.provisioner.core.exception.AggregateNotFoundException;
import com.ryuqq.provisioner.core.exception.ConcurrencyConflictException;
import com.ryuqq.provisioner.core.model.Request;
import com.ryuqq.provisioner.core.model.RequestId;
import com.ryuqq.provisioner.core.model.RequestStatus;
import com.ryuqq.provisioner.core.model.RequestType;
import com.ryuqq.provisioner.core.model.TemplateId;
import com.ryuqq.provisioner.core.spi.EventStore;
import com.ryuqq.provisioner.core.spi.IdGenerator;
import com.ryuqq.provisioner.core.spi.StoredSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventSourcedRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private EventSourcedRepository<Request, RequestEvent> repository;
    private IdGenerator ids;

    @BeforeEach
    void setUp() {
        AtomicInteger seq = new AtomicInteger();
        ids = () -> "evt-" + seq.incrementAndGet();
        repository = new EventSourcedRepository<>(new MapEventStore(), AggregateTypes.REQUEST);
    }

    private Request newRequest() {
        return Request.create(RequestId.of("req-1"), RequestType.PROVISION, TemplateId.of("tpl"), 2, List.of(), ids, T0);
    }

    @Test
    void save_신규_Aggregate는_버전_1() {
        long version = repository.save(newRequest(), 0);

        assertThat(version).isEqualTo(1);
        assertThat(repository.load("req-1").status()).isEqualTo(RequestStatus.PENDING);
        assertThat(repository.load("req-1").pendingEvents()).isEmpty();
    }

    @Test
    void save_같은_버전에_두번_쓰면_두번째는_충돌() {
        // given
        repository.save(newRequest(), 0);
        Request loaded = repository.load("req-1");
        Request first = loaded.record(loaded.proposeCancellation("a", ids, T0));
        Request second = loaded.record(loaded.proposeClaim(ids, T0));

        // when
        repository.save(first, 1);

        // then
        assertThatThrownBy(() -> repository.save(second, 1))
            .isInstanceOf(ConcurrencyConflictException.class);
        Request stored = repository.load("req-1");
        assertThat(stored.cancellationRequested()).isTrue();
        assertThat(stored.dispatchClaimedAt()).isNull();
    }

    @Test
    void update_충돌_후_다시_읽고_재적용() {
        repository.save(newRequest(), 0);
        AtomicInteger calls = new AtomicInteger();

        Request updated = repository.update("req-1", 3, current -> {
            if (calls.incrementAndGet() == 1) {
                // 다른 작성자가 먼저 기록
                repository.appendEvents("req-1", current.proposeCancellation("other", ids, T0), current.version());
            }
            return current.proposeFailure("failed", null, ids, T0);
        });

        assertThat(calls.get()).isEqualTo(2);
        assertThat(updated.status()).isEqualTo(RequestStatus.FAILED);
        assertThat(updated.cancellationRequested()).isTrue();
        assertThat(updated.version()).isEqualTo(3);
    }

    @Test
    void load_없는_Aggregate는_NotFound() {
        assertThatThrownBy(() -> repository.load("req-missing"))
            .isInstanceOf(AggregateNotFoundException.class);
    }

    @Test
    void save_기준_버전과_다른_expectedVersion은_거부() {
        assertThatThrownBy(() -> repository.save(newRequest(), 5))
            .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * 최소 구현 저장소 (계약 검증은 testkit의 contract test가 담당).
     */
    private static final class MapEventStore implements EventStore<RequestEvent, Request> {

        private final Map<String, List<RequestEvent>> events = new HashMap<>();
        private final Map<String, Request> snapshots = new HashMap<>();

        @Override
        public synchronized long append(String aggregateId, long expectedVersion,
                                        List<? extends RequestEvent> newEvents, Request snapshot) {
            List<RequestEvent> log = events.computeIfAbsent(aggregateId, k -> new ArrayList<>());
            if (log.size() != expectedVersion) {
                throw new ConcurrencyConflictException(aggregateId, expectedVersion, log.size());
            }
            log.addAll(newEvents);
            snapshots.put(aggregateId, snapshot);
            return log.size();
        }

        @Override
        public synchronized List<RequestEvent> loadEvents(String aggregateId) {
            return List.copyOf(events.getOrDefault(aggregateId, List.of()));
        }

        @Override
        public synchronized Optional<StoredSnapshot<Request>> loadSnapshot(String aggregateId) {
            Request snapshot = snapshots.get(aggregateId);
            return snapshot == null ? Optional.empty() : Optional.of(new StoredSnapshot<>(snapshot, snapshot.version()));
        }

        @Override
        public synchronized List<String> aggregateIds() {
            return List.copyOf(events.keySet());
        }

        @Override
        public boolean archive(String aggregateId) {
            return false;
        }
    }
}
