package com.ryuqq.provisioner.core.model;

import com.ryuqq.provisioner.core.event.RequestEvent;
import com.ryuqq.provisioner.core.event.RequestSettled;
import com.ryuqq.provisioner.core.exception.ErrorKind;
import com.ryuqq.provisioner.core.exception.InvalidRequestStateException;
import com.ryuqq.provisioner.core.spi.IdGenerator;
import com.ryuqq.provisioner.core.spi.ProvisioningHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Request Aggregate 테스트.
 *
 * <ul>
 *   <li>pending만 dispatch 가능 (중복 dispatch 거부)</li>
 *   <li>연결된 머신 수는 요청 수를 넘지 않음</li>
 *   <li>종료된 Request는 불변</li>
 *   <li>이벤트 로그 재생 결과가 누적 상태와 같음</li>
 * </ul>
 */
class RequestTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private IdGenerator ids;

    @BeforeEach
    void setUp() {
        AtomicInteger seq = new AtomicInteger();
        ids = () -> "evt-" + seq.incrementAndGet();
    }

    private Request newProvision(int count) {
        return Request.create(RequestId.of("req-1"), RequestType.PROVISION, TemplateId.of("tpl"), count,
            List.of(), ids, T0).markCommitted();
    }

    private BackendBinding binding() {
        return new BackendBinding("fleet",
            new ProvisioningHandle("fleet-1", BackendType.EC2_FLEET, 3, List.of(), null));
    }

    private Request running(int count) {
        Request request = newProvision(count);
        request = request.record(request.proposeClaim(ids, T0));
        return request.record(request.proposeDispatched(List.of(binding()), ids, T0.plusSeconds(1))).markCommitted();
    }

    @Test
    void create_StartsPendingWithVersionOne() {
        Request request = Request.create(RequestId.of("req-1"), RequestType.PROVISION, TemplateId.of("tpl"), 3,
            List.of(), ids, T0);

        assertEquals(RequestStatus.PENDING, request.status());
        assertEquals(1, request.version());
        assertEquals(1, request.pendingEvents().size());
        assertEquals(0, request.committedVersion());
        assertEquals(T0, request.createdAt());
    }

    @Test
    void proposeClaim_Twice_IsRejected() {
        Request request = newProvision(3);
        Request claimed = request.record(request.proposeClaim(ids, T0));

        InvalidRequestStateException exception = assertThrows(
            InvalidRequestStateException.class,
            () -> claimed.proposeClaim(ids, T0)
        );
        assertTrue(exception.getMessage().contains("already claimed"));
        assertEquals(RequestStatus.PENDING, claimed.status());
    }

    @Test
    void proposeClaim_NotPending_IsRejectedWithoutStateChange() {
        Request request = running(3);

        assertThrows(InvalidRequestStateException.class, () -> request.proposeClaim(ids, T0));
        assertEquals(RequestStatus.RUNNING, request.status());
    }

    @Test
    void proposeDispatched_MovesToRunningAndRecordsBinding() {
        Request request = running(3);

        assertEquals(RequestStatus.RUNNING, request.status());
        assertEquals(1, request.bindings().size());
        assertEquals("fleet", request.bindings().get(0).strategyName());
        assertEquals(T0.plusSeconds(1), request.dispatchedAt());
    }

    @Test
    void proposeAttach_CapsAtRequestedCount() {
        Request request = running(2);
        List<MachineId> observed = List.of(MachineId.of("m-a"), MachineId.of("m-b"), MachineId.of("m-c"));

        Request attached = request.record(request.proposeAttach(observed, ids, T0));

        assertEquals(List.of(MachineId.of("m-a"), MachineId.of("m-b")), attached.machineIds());
        assertTrue(attached.proposeAttach(List.of(MachineId.of("m-c")), ids, T0).isEmpty());
    }

    @Test
    void proposeAttach_AlreadyAttached_IsNoOp() {
        Request request = running(2);
        request = request.record(request.proposeAttach(List.of(MachineId.of("m-a")), ids, T0));

        assertTrue(request.proposeAttach(List.of(MachineId.of("m-a")), ids, T0).isEmpty());
    }

    @Test
    void proposeCompletion_AllSucceed_Completes() {
        Request request = running(2);
        request = request.record(request.proposeAttach(List.of(MachineId.of("m-a"), MachineId.of("m-b")), ids, T0));
        List<Machine> machines = List.of(settled("m-a", MachineStatus.RUNNING), settled("m-b", MachineStatus.RUNNING));

        Request completed = request.record(request.proposeCompletion(machines, ids, T0.plusSeconds(5)));

        assertEquals(RequestStatus.COMPLETED, completed.status());
        assertEquals(T0.plusSeconds(5), completed.completedAt());
    }

    @Test
    void proposeCompletion_Mixed_CompletesWithError() {
        Request request = running(2);
        request = request.record(request.proposeAttach(List.of(MachineId.of("m-a"), MachineId.of("m-b")), ids, T0));
        List<Machine> machines = List.of(settled("m-a", MachineStatus.RUNNING), settled("m-b", MachineStatus.FAILED));

        Request completed = request.record(request.proposeCompletion(machines, ids, T0));

        assertEquals(RequestStatus.COMPLETED_WITH_ERROR, completed.status());
        assertTrue(completed.message().contains("1 of 2"));
    }

    @Test
    void proposeCompletion_PartialVisibility_StaysRunning() {
        Request request = running(3);
        request = request.record(request.proposeAttach(List.of(MachineId.of("m-a")), ids, T0));

        List<RequestEvent> events = request.proposeCompletion(List.of(settled("m-a", MachineStatus.RUNNING)), ids, T0);

        assertTrue(events.isEmpty());
    }

    @Test
    void proposeTimeout_AfterDeadline_ForcesCompletedWithError() {
        Request request = running(3);

        assertTrue(request.proposeTimeout(Duration.ofMinutes(10), ids, T0.plusSeconds(60)).isEmpty());

        List<RequestEvent> events = request.proposeTimeout(Duration.ofMinutes(10), ids, T0.plus(Duration.ofMinutes(11)));
        Request timedOut = request.record(events);

        assertEquals(RequestStatus.COMPLETED_WITH_ERROR, timedOut.status());
        assertEquals(ErrorKind.TIMEOUT, timedOut.errorKind());
    }

    @Test
    void apply_OnTerminalRequest_IsRejected() {
        Request request = newProvision(1);
        Request failed = request.record(request.proposeFailure("boom", ErrorKind.PERMANENT_BACKEND, ids, T0));

        assertEquals(RequestStatus.FAILED, failed.status());
        assertTrue(failed.proposeFailure("again", ErrorKind.PERMANENT_BACKEND, ids, T0).isEmpty());
        assertThrows(InvalidRequestStateException.class,
            () -> failed.apply(new RequestSettled("evt-x", failed.id(), T0, RequestStatus.COMPLETED, null, null)));
        assertThrows(InvalidRequestStateException.class, () -> failed.proposeCancellation("late", ids, T0));
    }

    @Test
    void proposeCancellation_IsIdempotent() {
        Request request = running(1);
        Request cancelled = request.record(request.proposeCancellation("operator", ids, T0));

        assertTrue(cancelled.cancellationRequested());
        assertEquals("operator", cancelled.cancellationReason());
        assertTrue(cancelled.proposeCancellation("operator", ids, T0).isEmpty());
    }

    @Test
    void replay_ReproducesAccumulatedState() {
        List<RequestEvent> log = new ArrayList<>();
        Request request = Request.create(RequestId.of("req-1"), RequestType.PROVISION, TemplateId.of("tpl"), 1,
            List.of(), ids, T0);
        log.addAll(request.pendingEvents());
        List<RequestEvent> claim = request.proposeClaim(ids, T0);
        request = request.record(claim);
        log.addAll(claim);
        List<RequestEvent> dispatched = request.proposeDispatched(List.of(binding()), ids, T0);
        request = request.record(dispatched);
        log.addAll(dispatched);

        Request replayed = Request.replay(log);

        assertEquals(request.markCommitted(), replayed);
        assertEquals(3, replayed.version());
    }

    private Machine settled(String id, MachineStatus status) {
        Machine machine = Machine.register(MachineId.of(id), RequestId.of("req-1"), id, "fleet", ids, T0);
        return machine.record(machine.proposeObservation(
            com.ryuqq.provisioner.core.spi.MachineStatusReport.of(id, status), ids, T0));
    }
}
