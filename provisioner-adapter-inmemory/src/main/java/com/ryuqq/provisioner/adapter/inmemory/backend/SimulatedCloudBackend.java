package com.ryuqq.provisioner.adapter.inmemory.backend;

import com.ryuqq.provisioner.core.exception.PermanentBackendException;
import com.ryuqq.provisioner.core.model.BackendType;
import com.ryuqq.provisioner.core.model.MachineStatus;
import com.ryuqq.provisioner.core.spi.BackendHandle;
import com.ryuqq.provisioner.core.spi.CloudBackend;
import com.ryuqq.provisioner.core.spi.HealthState;
import com.ryuqq.provisioner.core.spi.IdGenerator;
import com.ryuqq.provisioner.core.spi.MachineStatusReport;
import com.ryuqq.provisioner.core.spi.ProvisioningHandle;
import com.ryuqq.provisioner.core.spi.TerminationHandle;
import com.ryuqq.provisioner.core.template.ResolvedSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 클라우드 API 없이 동작하는 시뮬레이션 백엔드.
 *
 * <p>provision은 요청 수만큼 PENDING 인스턴스를 만들고, 각 인스턴스는 poll을
 * {@code pollsUntilRunning}번 받으면 RUNNING이 됩니다. terminate된 인스턴스는 다음 poll에서
 * STOPPING, 그 다음 poll에서 TERMINATED가 됩니다.</p>
 *
 * <p>{@code failEvery}가 양수이면 그 배수 번째로 만들어진 인스턴스는 RUNNING 대신 FAILED가 됩니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class SimulatedCloudBackend implements CloudBackend {

    private static final Logger log = LoggerFactory.getLogger(SimulatedCloudBackend.class);

    private final BackendType backendType;
    private final IdGenerator ids;
    private final Clock clock;
    private final int pollsUntilRunning;
    private final int failEvery;
    private final Map<String, List<String>> handles = new ConcurrentHashMap<>();
    private final Map<String, Instance> instances = new ConcurrentHashMap<>();
    private volatile int created;

    public SimulatedCloudBackend(BackendType backendType, IdGenerator ids, Clock clock) {
        this(backendType, ids, clock, 1, 0);
    }

    public SimulatedCloudBackend(BackendType backendType, IdGenerator ids, Clock clock,
                                 int pollsUntilRunning, int failEvery) {
        if (backendType == null) {
            throw new IllegalArgumentException("backendType cannot be null");
        }
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (pollsUntilRunning < 0) {
            throw new IllegalArgumentException("pollsUntilRunning cannot be negative (current: " + pollsUntilRunning + ")");
        }
        this.backendType = backendType;
        this.ids = ids;
        this.clock = clock;
        this.pollsUntilRunning = pollsUntilRunning;
        this.failEvery = failEvery;
    }

    @Override
    public synchronized ProvisioningHandle provision(ResolvedSpec spec, int count) {
        if (spec.backendType() != backendType) {
            throw new PermanentBackendException(
                "Simulated " + backendType.getApiName() + " backend cannot provision " + spec.backendType().getApiName());
        }
        String handleId = backendType.getApiName().toLowerCase() + "-" + ids.nextId();
        List<String> resourceIds = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            created++;
            String resourceId = "i-" + ids.nextId();
            boolean doomed = failEvery > 0 && created % failEvery == 0;
            instances.put(resourceId, new Instance(resourceId, doomed, created));
            resourceIds.add(resourceId);
        }
        handles.put(handleId, resourceIds);
        log.info("Simulated {} provisioned {} instances under {}", backendType.getApiName(), count, handleId);
        return new ProvisioningHandle(handleId, backendType, count, resourceIds, Map.of("simulated", "true"));
    }

    @Override
    public synchronized List<MachineStatusReport> pollStatus(BackendHandle handle) {
        List<String> resourceIds = handle instanceof ProvisioningHandle
            ? handles.getOrDefault(handle.handleId(), List.of())
            : handle.resourceIds();
        List<MachineStatusReport> reports = new ArrayList<>(resourceIds.size());
        for (String resourceId : resourceIds) {
            Instance instance = instances.get(resourceId);
            if (instance == null) {
                reports.add(MachineStatusReport.of(resourceId, MachineStatus.TERMINATED));
                continue;
            }
            instance.advance();
            reports.add(instance.report());
        }
        return reports;
    }

    @Override
    public synchronized TerminationHandle terminate(List<String> resourceIds) {
        for (String resourceId : resourceIds) {
            Instance instance = instances.get(resourceId);
            if (instance != null) {
                instance.terminating = true;
            }
        }
        log.info("Simulated {} terminating {}", backendType.getApiName(), resourceIds);
        return new TerminationHandle("terminate-" + ids.nextId(), resourceIds, Map.of("simulated", "true"));
    }

    @Override
    public HealthState healthCheck() {
        return HealthState.HEALTHY;
    }

    private final class Instance {

        private final String resourceId;
        private final boolean doomed;
        private final int ordinal;
        private MachineStatus status = MachineStatus.PENDING;
        private int polls;
        private boolean terminating;
        private java.time.Instant launchTime;

        private Instance(String resourceId, boolean doomed, int ordinal) {
            this.resourceId = resourceId;
            this.doomed = doomed;
            this.ordinal = ordinal;
        }

        private void advance() {
            polls++;
            if (status.isTerminal()) {
                return;
            }
            if (terminating) {
                status = status == MachineStatus.STOPPING ? MachineStatus.TERMINATED : MachineStatus.STOPPING;
                return;
            }
            if (status == MachineStatus.PENDING && polls >= pollsUntilRunning) {
                status = doomed ? MachineStatus.FAILED : MachineStatus.RUNNING;
                launchTime = clock.instant();
            }
        }

        private MachineStatusReport report() {
            boolean hasAddress = status == MachineStatus.RUNNING || status == MachineStatus.STOPPING;
            return new MachineStatusReport(resourceId, status,
                hasAddress ? "sim-host-" + ordinal : null,
                hasAddress ? "10.0." + (ordinal / 250) + "." + (ordinal % 250 + 1) : null,
                null,
                launchTime,
                status == MachineStatus.FAILED ? "Simulated launch failure" : null);
        }
    }
}
