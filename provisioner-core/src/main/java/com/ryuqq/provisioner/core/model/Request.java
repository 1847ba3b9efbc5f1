package com.ryuqq.provisioner.core.model;

import com.ryuqq.provisioner.core.event.CancellationRequested;
import com.ryuqq.provisioner.core.event.DispatchClaimed;
import com.ryuqq.provisioner.core.event.MachinesAttached;
import com.ryuqq.provisioner.core.event.RequestCreated;
import com.ryuqq.provisioner.core.event.RequestDispatched;
import com.ryuqq.provisioner.core.event.RequestEvent;
import com.ryuqq.provisioner.core.event.RequestSettled;
import com.ryuqq.provisioner.core.exception.ErrorKind;
import com.ryuqq.provisioner.core.exception.InvalidRequestStateException;
import com.ryuqq.provisioner.core.spi.IdGenerator;
import com.ryuqq.provisioner.core.statemachine.RequestStateTransition;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 프로비저닝 또는 반환 작업 하나를 표현하는 Aggregate.
 *
 * <p>현재 상태는 이벤트 로그의 left-fold이며, 상태를 바꾸는 방법은 이벤트 적용뿐입니다.
 * 결정 로직({@code propose*})은 순수 함수로 이벤트 목록만 반환하고, 저장은
 * 저장소의 낙관적 동시성 경로를 통해서만 일어납니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태에 도달한 Request는 더 이상 어떤 이벤트도 받지 않습니다.</li>
 *   <li>프로비저닝 Request에 연결된 머신 수는 요청 수를 넘지 않습니다.</li>
 *   <li>version은 반영된 이벤트 수와 같습니다.</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record Request(
    RequestId id,
    RequestType type,
    TemplateId templateId,
    int requestedCount,
    RequestStatus status,
    List<MachineId> machineIds,
    List<BackendBinding> bindings,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt,
    Instant dispatchClaimedAt,
    Instant dispatchedAt,
    boolean cancellationRequested,
    String cancellationReason,
    String message,
    ErrorKind errorKind,
    long version,
    List<RequestEvent> pendingEvents
) {

    public Request {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        machineIds = machineIds == null ? List.of() : List.copyOf(machineIds);
        bindings = bindings == null ? List.of() : List.copyOf(bindings);
        pendingEvents = pendingEvents == null ? List.of() : List.copyOf(pendingEvents);
    }

    // ---------------------------------------------------------------- factory

    /**
     * 새 Request 생성 (아직 저장되지 않음, RequestCreated가 pending 상태).
     *
     * @param id Request ID
     * @param type 요청 유형
     * @param templateId 템플릿 ID (반환 요청은 null)
     * @param requestedCount 요청 수 (양수)
     * @param machineIds 반환 요청의 대상 머신 (프로비저닝은 빈 목록)
     * @param ids 이벤트 ID 생성기
     * @param now 현재 시각
     * @return 버전 1, pending 이벤트 1개를 가진 Request
     */
    public static Request create(RequestId id, RequestType type, TemplateId templateId, int requestedCount,
                                 List<MachineId> machineIds, IdGenerator ids, Instant now) {
        RequestCreated created = new RequestCreated(
            ids.nextId(), id, now, type, templateId, requestedCount, machineIds);
        return fromCreated(created).withPending(List.of(created));
    }

    /**
     * 이벤트 로그로부터 현재 상태 복원.
     *
     * @param events 기록 순서의 이벤트 (첫 이벤트는 RequestCreated)
     * @return 복원된 Request (pending 이벤트 없음)
     * @throws IllegalArgumentException 로그가 비어 있거나 RequestCreated로 시작하지 않는 경우
     */
    public static Request replay(List<? extends RequestEvent> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be null or empty");
        }
        if (!(events.get(0) instanceof RequestCreated)) {
            throw new IllegalArgumentException(
                "First event must be RequestCreated (current: " + events.get(0).getClass().getSimpleName() + ")");
        }
        Request request = fromCreated((RequestCreated) events.get(0));
        for (int i = 1; i < events.size(); i++) {
            request = request.apply(events.get(i));
        }
        return request;
    }

    private static Request fromCreated(RequestCreated e) {
        return new Request(e.requestId(), e.requestType(), e.templateId(), e.requestedCount(),
            RequestStatus.PENDING, e.machineIds(), List.of(), e.occurredAt(), e.occurredAt(), null,
            null, null, false, null, null, null, 1, List.of());
    }

    // ------------------------------------------------------------------ fold

    /**
     * 이벤트 하나를 적용한 새 상태 반환 (version + 1).
     *
     * @param event 적용할 이벤트
     * @return 새 Request
     * @throws InvalidRequestStateException 현재 상태에서 허용되지 않는 이벤트인 경우
     */
    public Request apply(RequestEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (!event.requestId().equals(id)) {
            throw new IllegalArgumentException("Event " + event.eventId() + " belongs to " + event.requestId());
        }
        if (event instanceof RequestCreated) {
            throw new InvalidRequestStateException("Request " + id + " already created");
        }
        if (status.isTerminal()) {
            throw new InvalidRequestStateException(
                "Request " + id + " is terminal (" + status + ") and cannot accept "
                    + event.getClass().getSimpleName());
        }

        Draft d = new Draft(this);
        d.updatedAt = event.occurredAt();
        d.version = version + 1;

        if (event instanceof DispatchClaimed) {
            if (status != RequestStatus.PENDING) {
                throw new InvalidRequestStateException("Only pending requests can be claimed (current: " + status + ")");
            }
            d.dispatchClaimedAt = event.occurredAt();
        } else if (event instanceof RequestDispatched) {
            RequestDispatched dispatched = (RequestDispatched) event;
            RequestStateTransition.validate(status, RequestStatus.RUNNING);
            d.status = RequestStatus.RUNNING;
            d.bindings = dispatched.bindings();
            d.dispatchedAt = event.occurredAt();
        } else if (event instanceof MachinesAttached) {
            List<MachineId> merged = new ArrayList<>(machineIds);
            for (MachineId machineId : ((MachinesAttached) event).machineIds()) {
                if (!merged.contains(machineId)) {
                    merged.add(machineId);
                }
            }
            if (type == RequestType.PROVISION && merged.size() > requestedCount) {
                throw new InvalidRequestStateException(String.format(
                    "Request %s cannot hold %d machines (requested: %d)", id, merged.size(), requestedCount));
            }
            d.machineIds = merged;
        } else if (event instanceof CancellationRequested) {
            d.cancellationRequested = true;
            d.cancellationReason = ((CancellationRequested) event).reason();
        } else if (event instanceof RequestSettled) {
            RequestSettled settled = (RequestSettled) event;
            RequestStateTransition.validate(status, settled.status());
            d.status = settled.status();
            d.message = settled.message();
            d.errorKind = settled.errorKind();
            d.completedAt = event.occurredAt();
        }
        return d.build();
    }

    /**
     * 결정된 이벤트를 적용하고 pending 목록에 추가 (저장 전 상태).
     *
     * @param events 새 이벤트
     * @return 이벤트가 반영되고 pending에 쌓인 Request
     */
    public Request record(List<? extends RequestEvent> events) {
        Request next = this;
        for (RequestEvent event : events) {
            next = next.apply(event);
        }
        List<RequestEvent> pending = new ArrayList<>(pendingEvents);
        pending.addAll(events);
        return next.withPending(pending);
    }

    /**
     * 저장 완료 후 pending 이벤트 비우기.
     *
     * @return pending이 비어 있는 Request
     */
    public Request markCommitted() {
        return pendingEvents.isEmpty() ? this : withPending(List.of());
    }

    /**
     * pending 이벤트가 반영되기 전의 버전 (저장 시 expectedVersion).
     *
     * @return 마지막으로 저장된 버전
     */
    public long committedVersion() {
        return version - pendingEvents.size();
    }

    private Request withPending(List<RequestEvent> pending) {
        return new Request(id, type, templateId, requestedCount, status, machineIds, bindings, createdAt,
            updatedAt, completedAt, dispatchClaimedAt, dispatchedAt, cancellationRequested,
            cancellationReason, message, errorKind, version, pending);
    }

    // ------------------------------------------------------------- decisions

    /**
     * dispatch 선점.
     *
     * @throws InvalidRequestStateException pending이 아니거나 이미 선점되었거나 취소된 경우
     */
    public List<RequestEvent> proposeClaim(IdGenerator ids, Instant now) {
        if (status != RequestStatus.PENDING) {
            throw new InvalidRequestStateException(
                "Only pending requests can be dispatched (request: " + id + ", current: " + status.getWireValue() + ")");
        }
        if (dispatchClaimedAt != null) {
            throw new InvalidRequestStateException(
                "Request " + id + " was already claimed for dispatch at " + dispatchClaimedAt);
        }
        if (cancellationRequested) {
            throw new InvalidRequestStateException("Request " + id + " is cancelled");
        }
        return List.of(new DispatchClaimed(ids.nextId(), id, now));
    }

    /**
     * 백엔드 호출 성공 기록 (pending → running).
     */
    public List<RequestEvent> proposeDispatched(List<BackendBinding> newBindings, IdGenerator ids, Instant now) {
        RequestStateTransition.validate(status, RequestStatus.RUNNING);
        return List.of(new RequestDispatched(ids.nextId(), id, now, newBindings));
    }

    /**
     * 새로 관측된 머신 연결.
     *
     * <p>이미 연결된 머신은 제외하고, 프로비저닝 Request는 요청 수를 넘는 머신을 잘라냅니다.</p>
     *
     * @return 연결할 머신이 없으면 빈 목록
     */
    public List<RequestEvent> proposeAttach(Collection<MachineId> observed, IdGenerator ids, Instant now) {
        if (status.isTerminal()) {
            return List.of();
        }
        Set<MachineId> fresh = new LinkedHashSet<>(observed);
        fresh.removeAll(machineIds);
        List<MachineId> toAttach = new ArrayList<>(fresh);
        if (type == RequestType.PROVISION) {
            int room = requestedCount - machineIds.size();
            if (room <= 0) {
                return List.of();
            }
            if (toAttach.size() > room) {
                toAttach = toAttach.subList(0, room);
            }
        }
        if (toAttach.isEmpty()) {
            return List.of();
        }
        return List.of(new MachinesAttached(ids.nextId(), id, now, toAttach));
    }

    /**
     * 취소 표시.
     *
     * @return 이미 취소 표시된 경우 빈 목록
     * @throws InvalidRequestStateException 종료된 Request인 경우
     */
    public List<RequestEvent> proposeCancellation(String reason, IdGenerator ids, Instant now) {
        if (status.isTerminal()) {
            throw new InvalidRequestStateException(
                "Request " + id + " is already " + status.getWireValue() + " and cannot be cancelled");
        }
        if (cancellationRequested) {
            return List.of();
        }
        return List.of(new CancellationRequested(ids.nextId(), id, now, reason));
    }

    /**
     * 실패로 종결.
     *
     * @return 이미 종료된 경우 빈 목록 (no-op)
     */
    public List<RequestEvent> proposeFailure(String failureMessage, ErrorKind kind, IdGenerator ids, Instant now) {
        return proposeSettle(RequestStatus.FAILED, failureMessage, kind, ids, now);
    }

    /**
     * 지정한 종료 상태로 종결.
     *
     * @return 이미 종료된 경우 빈 목록 (no-op)
     */
    public List<RequestEvent> proposeSettle(RequestStatus terminal, String settleMessage, ErrorKind kind,
                                            IdGenerator ids, Instant now) {
        if (status.isTerminal()) {
            return List.of();
        }
        RequestStateTransition.validate(status, terminal);
        return List.of(new RequestSettled(ids.nextId(), id, now, terminal, settleMessage, kind));
    }

    /**
     * 머신 상태를 보고 완료 여부 판단.
     *
     * <ul>
     *   <li>프로비저닝: 결과가 확정된 머신 수가 요청 수에 도달하면 모두 SUCCEED일 때 COMPLETED,
     *       아니면 COMPLETED_WITH_ERROR</li>
     *   <li>반환: 모든 대상 머신이 종료 상태에 도달하면 모두 TERMINATED일 때 COMPLETED,
     *       아니면 COMPLETED_WITH_ERROR</li>
     * </ul>
     *
     * @param machines 이 Request와 관련된 머신 (ID로 매칭)
     * @return 아직 진행 중이면 빈 목록
     */
    public List<RequestEvent> proposeCompletion(Collection<Machine> machines, IdGenerator ids, Instant now) {
        if (status != RequestStatus.RUNNING) {
            return List.of();
        }
        Map<MachineId, Machine> byId = machines.stream()
            .collect(Collectors.toMap(Machine::id, Function.identity(), (a, b) -> b));

        if (type == RequestType.PROVISION) {
            long settled = machineIds.stream()
                .map(byId::get)
                .filter(m -> m != null && m.result().isSettled())
                .count();
            if (settled < requestedCount) {
                return List.of();
            }
            long failed = machineIds.stream()
                .map(byId::get)
                .filter(m -> m != null && m.result() == MachineResult.FAIL)
                .count();
            if (failed == 0) {
                return proposeSettle(RequestStatus.COMPLETED, null, null, ids, now);
            }
            return proposeSettle(RequestStatus.COMPLETED_WITH_ERROR,
                failed + " of " + requestedCount + " machines failed", null, ids, now);
        }

        long done = machineIds.stream()
            .map(byId::get)
            .filter(m -> m != null && m.status().isTerminal())
            .count();
        if (done < machineIds.size()) {
            return List.of();
        }
        long notTerminated = machineIds.stream()
            .map(byId::get)
            .filter(m -> m.status() != MachineStatus.TERMINATED)
            .count();
        if (notTerminated == 0) {
            return proposeSettle(RequestStatus.COMPLETED, null, null, ids, now);
        }
        return proposeSettle(RequestStatus.COMPLETED_WITH_ERROR,
            notTerminated + " of " + machineIds.size() + " machines did not terminate cleanly", null, ids, now);
    }

    /**
     * running 상태가 허용 시간을 넘었는지 판단하여 COMPLETED_WITH_ERROR로 강제 종결.
     *
     * @return 타임아웃이 아니면 빈 목록
     */
    public List<RequestEvent> proposeTimeout(Duration requestTimeout, IdGenerator ids, Instant now) {
        if (status != RequestStatus.RUNNING || dispatchedAt == null) {
            return List.of();
        }
        if (!now.isAfter(dispatchedAt.plus(requestTimeout))) {
            return List.of();
        }
        return proposeSettle(RequestStatus.COMPLETED_WITH_ERROR,
            String.format("Request timed out after %ds with %d of %d machines observed",
                requestTimeout.toSeconds(), machineIds.size(), requestedCount),
            ErrorKind.TIMEOUT, ids, now);
    }

    // --------------------------------------------------------------- queries

    public boolean isTerminal() {
        return status.isTerminal();
    }

    private static final class Draft {

        private final Request base;
        private RequestStatus status;
        private List<MachineId> machineIds;
        private List<BackendBinding> bindings;
        private Instant updatedAt;
        private Instant completedAt;
        private Instant dispatchClaimedAt;
        private Instant dispatchedAt;
        private boolean cancellationRequested;
        private String cancellationReason;
        private String message;
        private ErrorKind errorKind;
        private long version;

        private Draft(Request base) {
            this.base = base;
            this.status = base.status;
            this.machineIds = base.machineIds;
            this.bindings = base.bindings;
            this.updatedAt = base.updatedAt;
            this.completedAt = base.completedAt;
            this.dispatchClaimedAt = base.dispatchClaimedAt;
            this.dispatchedAt = base.dispatchedAt;
            this.cancellationRequested = base.cancellationRequested;
            this.cancellationReason = base.cancellationReason;
            this.message = base.message;
            this.errorKind = base.errorKind;
            this.version = base.version;
        }

        private Request build() {
            return new Request(base.id, base.type, base.templateId, base.requestedCount, status, machineIds,
                bindings, base.createdAt, updatedAt, completedAt, dispatchClaimedAt, dispatchedAt,
                cancellationRequested, cancellationReason, message, errorKind, version, base.pendingEvents);
        }
    }
}
