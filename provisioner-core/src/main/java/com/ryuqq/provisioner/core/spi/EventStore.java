package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.event.DomainEvent;

import java.util.List;
import java.util.Optional;

/**
 * Aggregate 단위 append-only 이벤트 로그 + 스냅샷 저장소 SPI.
 *
 * <p>파일, 관계형 DB, 인메모리 등 어떤 저장 방식이든 이 계약 뒤에 숨겨지며,
 * 오케스트레이션 로직은 활성화된 구현에 의존하지 않습니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>낙관적 동시성: expectedVersion이 저장된 버전과 다르면
 *       {@code ConcurrencyConflictException}으로 거부하고 아무것도 기록하지 않습니다.</li>
 *   <li>중복 제거: 이미 저장된 eventId를 가진 이벤트는 다시 기록하지 않습니다.
 *       append한 모든 이벤트가 중복이면 현재 버전을 반환하는 멱등 no-op입니다.
 *       일부만 중복이면 중복 개수만큼 이미 반영된 것으로 보고 버전을 검사합니다.</li>
 *   <li>원자성: 이벤트와 스냅샷은 함께 기록되거나 함께 기록되지 않습니다.</li>
 *   <li>보관(archive): 스트림을 활성 인덱스에서 제외하지만 물리 삭제하지 않으며 계속 로드할 수 있습니다.</li>
 * </ul>
 *
 * <p><strong>Thread-Safety:</strong> 구현체는 thread-safe해야 합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param <E> 이벤트 타입
 * @param <S> 스냅샷 타입
 */
public interface EventStore<E extends DomainEvent, S> {

    /**
     * 이벤트 추가 및 스냅샷 갱신.
     *
     * @param aggregateId Aggregate ID
     * @param expectedVersion 호출자가 읽은 버전 (신규 Aggregate는 0)
     * @param events 추가할 이벤트 (비어 있으면 안 됨)
     * @param snapshot 이벤트 반영 후 스냅샷
     * @return 새 버전
     * @throws com.ryuqq.provisioner.core.exception.ConcurrencyConflictException 버전 불일치
     */
    long append(String aggregateId, long expectedVersion, List<? extends E> events, S snapshot);

    /**
     * 이벤트 로그 전체 조회 (기록 순서).
     *
     * @param aggregateId Aggregate ID
     * @return 이벤트 목록 (없으면 빈 목록)
     */
    List<E> loadEvents(String aggregateId);

    /**
     * 최신 스냅샷 조회.
     *
     * @param aggregateId Aggregate ID
     * @return 스냅샷 (없으면 empty)
     */
    Optional<StoredSnapshot<S>> loadSnapshot(String aggregateId);

    /**
     * 활성(보관되지 않은) Aggregate ID 목록.
     *
     * @return ID 목록 (최초 기록 순서)
     */
    List<String> aggregateIds();

    /**
     * Aggregate를 활성 인덱스에서 제외.
     *
     * @param aggregateId Aggregate ID
     * @return 보관 처리되었으면 true, 없거나 이미 보관된 경우 false
     */
    boolean archive(String aggregateId);
}
