package com.ryuqq.provisioner.adapter.runner.runtime;

import com.ryuqq.provisioner.application.engine.ProvisioningEngine;
import com.ryuqq.provisioner.core.event.MachineEvent;
import com.ryuqq.provisioner.core.event.RequestEvent;
import com.ryuqq.provisioner.core.exception.ErrorKind;
import com.ryuqq.provisioner.core.model.Machine;
import com.ryuqq.provisioner.core.model.MachineId;
import com.ryuqq.provisioner.core.model.Request;
import com.ryuqq.provisioner.core.model.RequestStatus;
import com.ryuqq.provisioner.core.repository.EventSourcedRepository;
import com.ryuqq.provisioner.core.spi.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Reaper 컴포넌트.
 *
 * <p>오래 방치된 pending Request를 정리하고, 보관 기간이 지난 종료 Request를 보관 처리합니다.</p>
 *
 * <p><strong>리컨실 시나리오:</strong></p>
 * <pre>
 * 1. dispatch가 DispatchClaimed 기록 후 provision 호출
 * 2. 프로세스 중단 → running 전이가 기록되지 않음
 * 3. Request는 pending + 선점 상태로 남음 (다른 dispatch는 거부됨)
 * 4. Reaper가 주기적 스캔 (예: 5분마다)
 * 5. staleDispatchThreshold 초과 Request 발견
 * 6. 처리:
 *    - 선점된 Request: failed(TIMEOUT) (provision 결과를 알 수 없음)
 *    - 선점되지 않은 Request: RETRY → dispatch, FAIL → failed(TIMEOUT)
 * </pre>
 *
 * <p><strong>보관 정책:</strong></p>
 * <ul>
 *   <li>completedAt + retention이 지난 종료 Request의 스트림을 보관 처리</li>
 *   <li>연결된 머신 중 종료된 머신도 함께 보관 처리 (사용 중인 머신은 유지)</li>
 *   <li>보관된 스트림은 활성 목록에서 빠지지만 삭제되지 않으며 계속 조회 가능</li>
 * </ul>
 *
 * <p>한 항목의 실패는 로그만 남기고 다음 항목으로 진행합니다. 모든 처리가 멱등하므로
 * 여러 Reaper 인스턴스가 동시에 실행되어도 안전합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class Reaper {

    private static final Logger log = LoggerFactory.getLogger(Reaper.class);

    private final EventSourcedRepository<Request, RequestEvent> requests;
    private final EventSourcedRepository<Machine, MachineEvent> machines;
    private final ProvisioningEngine engine;
    private final ReaperConfig config;
    private final IdGenerator idGenerator;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public Reaper(EventSourcedRepository<Request, RequestEvent> requests,
                  EventSourcedRepository<Machine, MachineEvent> machines,
                  ProvisioningEngine engine,
                  ReaperConfig config,
                  IdGenerator idGenerator,
                  Clock clock) {
        if (requests == null) {
            throw new IllegalArgumentException("requests cannot be null");
        }
        if (machines == null) {
            throw new IllegalArgumentException("machines cannot be null");
        }
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (idGenerator == null) {
            throw new IllegalArgumentException("idGenerator cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.requests = requests;
        this.machines = machines;
        this.engine = engine;
        this.config = config;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    /**
     * 스캔 1회 실행.
     *
     * <p>주기적으로 호출되어야 합니다 ({@link ReaperConfig#scanIntervalMs()} 간격).
     * 한 번에 batchSize개까지 처리합니다.</p>
     *
     * @return 처리 결과
     */
    public ScanResult scan() {
        log.info("Reaper scan started");
        Instant now = clock.instant();
        Instant staleBefore = now.minusMillis(config.staleDispatchThresholdMs());
        Instant retainedAfter = now.minusMillis(config.retentionMs());

        int reconciled = 0;
        int archived = 0;
        int handled = 0;
        for (String id : requests.ids()) {
            if (handled >= config.batchSize()) {
                break;
            }
            Optional<Request> found = requests.find(id);
            if (found.isEmpty()) {
                continue;
            }
            Request request = found.get();
            if (isStale(request, staleBefore)) {
                handled++;
                if (tryReconcile(request)) {
                    reconciled++;
                }
            } else if (isExpired(request, retainedAfter)) {
                handled++;
                if (tryArchive(request)) {
                    archived++;
                }
            }
        }

        log.info("Reaper scan completed: {} reconciled, {} archived", reconciled, archived);
        return new ScanResult(reconciled, archived);
    }

    private static boolean isStale(Request request, Instant staleBefore) {
        if (request.status() != RequestStatus.PENDING) {
            return false;
        }
        Instant since = request.dispatchClaimedAt() != null ? request.dispatchClaimedAt() : request.createdAt();
        return since.isBefore(staleBefore);
    }

    private static boolean isExpired(Request request, Instant retainedAfter) {
        return request.isTerminal()
            && request.completedAt() != null
            && request.completedAt().isBefore(retainedAfter);
    }

    /**
     * 개별 Request 리컨실 시도.
     *
     * <p>예외 발생 시에도 계속 진행하여 다른 항목 처리를 방해하지 않습니다.</p>
     *
     * @return 리컨실 성공 여부
     */
    private boolean tryReconcile(Request request) {
        try {
            if (request.dispatchClaimedAt() != null) {
                fail(request, "Dispatch claimed at " + request.dispatchClaimedAt() + " never completed");
                return true;
            }
            switch (config.defaultStrategy()) {
                case RETRY -> {
                    Request dispatched = engine.dispatch(request.id());
                    log.info("Reaper re-dispatched {} ({})", request.id(), dispatched.status().getWireValue());
                }
                case FAIL -> fail(request, "Request was not dispatched within "
                    + Duration.ofMillis(config.staleDispatchThresholdMs()));
            }
            return true;
        } catch (Exception e) {
            log.error("Failed to reconcile {} in Reaper scan", request.id(), e);
            return false;
        }
    }

    private void fail(Request request, String message) {
        Instant now = clock.instant();
        requests.update(request.id().getValue(), 1,
            r -> r.proposeFailure(message, ErrorKind.TIMEOUT, idGenerator, now));
        log.info("Reaper marked {} as failed: {}", request.id(), message);
    }

    private boolean tryArchive(Request request) {
        try {
            int archivedMachines = 0;
            for (MachineId machineId : request.machineIds()) {
                Optional<Machine> machine = machines.find(machineId.getValue());
                if (machine.isPresent() && machine.get().isTerminal()
                    && machines.archive(machineId.getValue())) {
                    archivedMachines++;
                }
            }
            requests.archive(request.id().getValue());
            log.info("Reaper archived {} with {} terminal machines", request.id(), archivedMachines);
            return true;
        } catch (Exception e) {
            log.error("Failed to archive {} in Reaper scan", request.id(), e);
            return false;
        }
    }

    /**
     * 스캔 결과.
     *
     * @param reconciled 리컨실된 pending Request 수
     * @param archived 보관 처리된 종료 Request 수
     */
    public record ScanResult(int reconciled, int archived) {
    }
}
