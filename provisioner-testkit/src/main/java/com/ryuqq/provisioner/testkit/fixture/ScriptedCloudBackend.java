package com.ryuqq.provisioner.testkit.fixture;

import com.ryuqq.provisioner.core.model.BackendType;
import com.ryuqq.provisioner.core.model.MachineStatus;
import com.ryuqq.provisioner.core.spi.BackendHandle;
import com.ryuqq.provisioner.core.spi.CloudBackend;
import com.ryuqq.provisioner.core.spi.HealthState;
import com.ryuqq.provisioner.core.spi.MachineStatusReport;
import com.ryuqq.provisioner.core.spi.ProvisioningHandle;
import com.ryuqq.provisioner.core.spi.TerminationHandle;
import com.ryuqq.provisioner.core.template.ResolvedSpec;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cloud backend whose behaviour is scripted by the test.
 *
 * <p>Provision calls consume queued failures first, then succeed with a handle named
 * {@code <name>-handle-N}. Poll calls return whatever reports the test has placed on the
 * handle. Every call is counted so tests can assert that a backend was (or was not) contacted.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class ScriptedCloudBackend implements CloudBackend {

    private final String name;
    private final BackendType backendType;
    private final Deque<RuntimeException> provisionFailures = new ArrayDeque<>();
    private final Deque<RuntimeException> terminateFailures = new ArrayDeque<>();
    private final Map<String, List<MachineStatusReport>> reports = new LinkedHashMap<>();
    private final List<ResolvedSpec> provisionedSpecs = new ArrayList<>();
    private final List<List<String>> terminated = new ArrayList<>();
    private final AtomicInteger provisionCalls = new AtomicInteger();
    private final AtomicInteger pollCalls = new AtomicInteger();
    private final AtomicInteger terminateCalls = new AtomicInteger();
    private final AtomicInteger handleSeq = new AtomicInteger();
    private volatile HealthState health = HealthState.HEALTHY;
    private volatile RuntimeException alwaysFail;

    public ScriptedCloudBackend(String name, BackendType backendType) {
        this.name = name;
        this.backendType = backendType;
    }

    public ScriptedCloudBackend failNextProvision(RuntimeException failure) {
        provisionFailures.add(failure);
        return this;
    }

    public ScriptedCloudBackend failNextTerminate(RuntimeException failure) {
        terminateFailures.add(failure);
        return this;
    }

    /**
     * Every call (provision, poll, terminate) throws the given failure until cleared with {@code null}.
     */
    public ScriptedCloudBackend failAlways(RuntimeException failure) {
        this.alwaysFail = failure;
        return this;
    }

    public ScriptedCloudBackend health(HealthState health) {
        this.health = health;
        return this;
    }

    /**
     * Replaces the reports returned when polling the given handle.
     */
    public synchronized void report(String handleId, List<MachineStatusReport> machineReports) {
        reports.put(handleId, new ArrayList<>(machineReports));
    }

    /**
     * Reports {@code count} machines {@code <handleId>-i-1..count} in the given status.
     */
    public synchronized void reportAll(String handleId, int count, MachineStatus status) {
        List<MachineStatusReport> list = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            list.add(new MachineStatusReport(handleId + "-i-" + i, status, "host-" + i,
                "10.0.0." + i, null, null, null));
        }
        reports.put(handleId, list);
    }

    @Override
    public synchronized ProvisioningHandle provision(ResolvedSpec spec, int count) {
        provisionCalls.incrementAndGet();
        if (alwaysFail != null) {
            throw alwaysFail;
        }
        RuntimeException failure = provisionFailures.poll();
        if (failure != null) {
            throw failure;
        }
        provisionedSpecs.add(spec);
        String handleId = name + "-handle-" + handleSeq.incrementAndGet();
        reports.putIfAbsent(handleId, new ArrayList<>());
        return new ProvisioningHandle(handleId, backendType, count, List.of(), Map.of());
    }

    @Override
    public synchronized List<MachineStatusReport> pollStatus(BackendHandle handle) {
        pollCalls.incrementAndGet();
        if (alwaysFail != null) {
            throw alwaysFail;
        }
        if (handle instanceof TerminationHandle) {
            List<MachineStatusReport> result = new ArrayList<>();
            for (String resourceId : handle.resourceIds()) {
                result.add(MachineStatusReport.of(resourceId, MachineStatus.TERMINATED));
            }
            return result;
        }
        return List.copyOf(reports.getOrDefault(handle.handleId(), List.of()));
    }

    @Override
    public synchronized TerminationHandle terminate(List<String> resourceIds) {
        terminateCalls.incrementAndGet();
        if (alwaysFail != null) {
            throw alwaysFail;
        }
        RuntimeException failure = terminateFailures.poll();
        if (failure != null) {
            throw failure;
        }
        terminated.add(List.copyOf(resourceIds));
        return new TerminationHandle(name + "-terminate-" + handleSeq.incrementAndGet(), resourceIds, Map.of());
    }

    @Override
    public HealthState healthCheck() {
        return health;
    }

    public int provisionCalls() {
        return provisionCalls.get();
    }

    public int pollCalls() {
        return pollCalls.get();
    }

    public int terminateCalls() {
        return terminateCalls.get();
    }

    public synchronized List<ResolvedSpec> provisionedSpecs() {
        return List.copyOf(provisionedSpecs);
    }

    public synchronized List<List<String>> terminatedBatches() {
        return List.copyOf(terminated);
    }

    public String name() {
        return name;
    }
}
