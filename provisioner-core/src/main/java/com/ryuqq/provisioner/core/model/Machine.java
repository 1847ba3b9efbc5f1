package com.ryuqq.provisioner.core.model;

import com.ryuqq.provisioner.core.event.MachineEvent;
import com.ryuqq.provisioner.core.event.MachineObserved;
import com.ryuqq.provisioner.core.event.MachineRegistered;
import com.ryuqq.provisioner.core.event.MachineResultSettled;
import com.ryuqq.provisioner.core.event.MachineReturnRequested;
import com.ryuqq.provisioner.core.exception.InvalidMachineStateException;
import com.ryuqq.provisioner.core.spi.IdGenerator;
import com.ryuqq.provisioner.core.spi.MachineStatusReport;
import com.ryuqq.provisioner.core.statemachine.MachineResultTransition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 관리 대상 클라우드 인스턴스 하나를 표현하는 Aggregate.
 *
 * <p>Machine은 항상 정확히 하나의 Request를 참조하며, Request와 독립적으로 저장되고
 * ID로만 연결됩니다. status가 TERMINATED 또는 FAILED가 되면 더 이상 관측하지 않습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record Machine(
    MachineId id,
    RequestId requestId,
    String resourceId,
    String strategyName,
    String name,
    MachineStatus status,
    MachineResult result,
    String privateIpAddress,
    String publicIpAddress,
    Instant launchTime,
    Instant lastObservedAt,
    String message,
    RequestId returnRequestId,
    Instant createdAt,
    long version,
    List<MachineEvent> pendingEvents
) {

    public Machine {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        pendingEvents = pendingEvents == null ? List.of() : List.copyOf(pendingEvents);
    }

    /**
     * 백엔드가 보고한 새 리소스로 Machine 생성 (아직 저장되지 않음).
     *
     * @return 버전 1, pending 이벤트 1개를 가진 Machine
     */
    public static Machine register(MachineId id, RequestId requestId, String resourceId, String strategyName,
                                   IdGenerator ids, Instant now) {
        MachineRegistered registered = new MachineRegistered(ids.nextId(), id, now, requestId, resourceId, strategyName);
        return fromRegistered(registered).withPending(List.of(registered));
    }

    /**
     * 이벤트 로그로부터 현재 상태 복원.
     *
     * @param events 기록 순서의 이벤트 (첫 이벤트는 MachineRegistered)
     * @return 복원된 Machine
     */
    public static Machine replay(List<? extends MachineEvent> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be null or empty");
        }
        if (!(events.get(0) instanceof MachineRegistered)) {
            throw new IllegalArgumentException(
                "First event must be MachineRegistered (current: " + events.get(0).getClass().getSimpleName() + ")");
        }
        Machine machine = fromRegistered((MachineRegistered) events.get(0));
        for (int i = 1; i < events.size(); i++) {
            machine = machine.apply(events.get(i));
        }
        return machine;
    }

    private static Machine fromRegistered(MachineRegistered e) {
        return new Machine(e.machineId(), e.requestId(), e.resourceId(), e.strategyName(), null,
            MachineStatus.PENDING, MachineResult.EXECUTING, null, null, null, null, null, null,
            e.occurredAt(), 1, List.of());
    }

    /**
     * 이벤트 하나를 적용한 새 상태 반환 (version + 1).
     *
     * @throws InvalidMachineStateException 종료된 머신을 관측하거나 결과를 다시 확정하려는 경우
     */
    public Machine apply(MachineEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (!event.machineId().equals(id)) {
            throw new IllegalArgumentException("Event " + event.eventId() + " belongs to " + event.machineId());
        }
        if (event instanceof MachineRegistered) {
            throw new InvalidMachineStateException("Machine " + id + " already registered");
        }
        if (event instanceof MachineObserved) {
            MachineObserved observed = (MachineObserved) event;
            if (status.isTerminal()) {
                throw new InvalidMachineStateException(
                    "Machine " + id + " is " + status.getWireValue() + " and is no longer observed");
            }
            return new Machine(id, requestId, resourceId, strategyName,
                observed.name() != null ? observed.name() : name,
                observed.status(), result,
                observed.privateIpAddress() != null ? observed.privateIpAddress() : privateIpAddress,
                observed.publicIpAddress() != null ? observed.publicIpAddress() : publicIpAddress,
                observed.launchTime() != null ? observed.launchTime() : launchTime,
                observed.occurredAt(),
                observed.message() != null ? observed.message() : message,
                returnRequestId, createdAt, version + 1, pendingEvents);
        }
        if (event instanceof MachineResultSettled) {
            MachineResult next = ((MachineResultSettled) event).result();
            MachineResultTransition.validate(result, next);
            return new Machine(id, requestId, resourceId, strategyName, name, status, next, privateIpAddress,
                publicIpAddress, launchTime, lastObservedAt, message, returnRequestId, createdAt, version + 1,
                pendingEvents);
        }
        if (event instanceof MachineReturnRequested) {
            if (status.isTerminal()) {
                throw new InvalidMachineStateException("Machine " + id + " is already " + status.getWireValue());
            }
            return new Machine(id, requestId, resourceId, strategyName, name, status, result, privateIpAddress,
                publicIpAddress, launchTime, lastObservedAt, message,
                ((MachineReturnRequested) event).returnRequestId(), createdAt, version + 1, pendingEvents);
        }
        throw new IllegalArgumentException("Unsupported event: " + event.getClass().getName());
    }

    /**
     * 결정된 이벤트를 적용하고 pending 목록에 추가.
     */
    public Machine record(List<? extends MachineEvent> events) {
        Machine next = this;
        for (MachineEvent event : events) {
            next = next.apply(event);
        }
        List<MachineEvent> pending = new ArrayList<>(pendingEvents);
        pending.addAll(events);
        return next.withPending(pending);
    }

    public Machine markCommitted() {
        return pendingEvents.isEmpty() ? this : withPending(List.of());
    }

    public long committedVersion() {
        return version - pendingEvents.size();
    }

    private Machine withPending(List<MachineEvent> pending) {
        return new Machine(id, requestId, resourceId, strategyName, name, status, result, privateIpAddress,
            publicIpAddress, launchTime, lastObservedAt, message, returnRequestId, createdAt, version, pending);
    }

    /**
     * poll 결과 반영.
     *
     * <p>관측 이벤트를 만들고, 결과 플래그가 아직 EXECUTING이며 관측 상태가 결과를 확정하면
     * 결과 확정 이벤트를 함께 만듭니다.</p>
     *
     * @return 이미 종료된 머신이면 빈 목록
     */
    public List<MachineEvent> proposeObservation(MachineStatusReport report, IdGenerator ids, Instant now) {
        if (status.isTerminal()) {
            return List.of();
        }
        List<MachineEvent> events = new ArrayList<>(2);
        events.add(new MachineObserved(ids.nextId(), id, now, report.status(), report.name(),
            report.privateIpAddress(), report.publicIpAddress(), report.launchTime(), report.message()));
        if (!result.isSettled()) {
            MachineResult derived = MachineResultTransition.resultFor(report.status());
            if (derived.isSettled()) {
                events.add(new MachineResultSettled(ids.nextId(), id, now, derived));
            }
        }
        return events;
    }

    /**
     * 반환 요청 대상으로 표시.
     *
     * @return 같은 반환 요청으로 이미 표시된 경우 빈 목록
     * @throws InvalidMachineStateException 이미 종료되었거나 다른 반환 요청이 진행 중인 경우
     */
    public List<MachineEvent> proposeReturn(RequestId returnRequest, IdGenerator ids, Instant now) {
        if (returnRequest.equals(returnRequestId)) {
            return List.of();
        }
        if (status.isTerminal()) {
            throw new InvalidMachineStateException("Machine " + id + " is already " + status.getWireValue());
        }
        if (returnRequestId != null) {
            throw new InvalidMachineStateException(
                "Machine " + id + " is already being returned by " + returnRequestId);
        }
        return List.of(new MachineReturnRequested(ids.nextId(), id, now, returnRequest));
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
