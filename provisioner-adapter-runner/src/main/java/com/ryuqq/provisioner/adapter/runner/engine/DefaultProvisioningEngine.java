package com.ryuqq.provisioner.adapter.runner.engine;

import com.ryuqq.provisioner.adapter.runner.resilience.ResilientExecutor;
import com.ryuqq.provisioner.application.engine.ProvisioningEngine;
import com.ryuqq.provisioner.core.event.MachineEvent;
import com.ryuqq.provisioner.core.event.RequestEvent;
import com.ryuqq.provisioner.core.exception.CircuitOpenException;
import com.ryuqq.provisioner.core.exception.ConcurrencyConflictException;
import com.ryuqq.provisioner.core.exception.ErrorKind;
import com.ryuqq.provisioner.core.exception.InvalidMachineStateException;
import com.ryuqq.provisioner.core.exception.InvalidRequestStateException;
import com.ryuqq.provisioner.core.exception.NoSuitableStrategyException;
import com.ryuqq.provisioner.core.exception.ProvisioningException;
import com.ryuqq.provisioner.core.exception.TemplateConfigurationException;
import com.ryuqq.provisioner.core.exception.TemplateResolutionException;
import com.ryuqq.provisioner.core.model.BackendBinding;
import com.ryuqq.provisioner.core.model.Machine;
import com.ryuqq.provisioner.core.model.MachineId;
import com.ryuqq.provisioner.core.model.PriceType;
import com.ryuqq.provisioner.core.model.Request;
import com.ryuqq.provisioner.core.model.RequestId;
import com.ryuqq.provisioner.core.model.RequestStatus;
import com.ryuqq.provisioner.core.model.RequestType;
import com.ryuqq.provisioner.core.model.Template;
import com.ryuqq.provisioner.core.model.TemplateId;
import com.ryuqq.provisioner.core.protection.BackendOperation;
import com.ryuqq.provisioner.core.protection.CircuitBreakerState;
import com.ryuqq.provisioner.core.repository.EventSourcedRepository;
import com.ryuqq.provisioner.core.spi.BackendHandle;
import com.ryuqq.provisioner.core.spi.CloudBackend;
import com.ryuqq.provisioner.core.spi.ConfigSource;
import com.ryuqq.provisioner.core.spi.IdGenerator;
import com.ryuqq.provisioner.core.spi.MachineStatusReport;
import com.ryuqq.provisioner.core.spi.ProvisioningHandle;
import com.ryuqq.provisioner.core.spi.TerminationHandle;
import com.ryuqq.provisioner.core.spi.UuidIdGenerator;
import com.ryuqq.provisioner.core.strategy.SelectionCriteria;
import com.ryuqq.provisioner.core.strategy.StrategyRegistration;
import com.ryuqq.provisioner.core.strategy.StrategyRegistry;
import com.ryuqq.provisioner.core.template.ResolvedSpec;
import com.ryuqq.provisioner.core.template.RuntimeContext;
import com.ryuqq.provisioner.core.template.TemplateResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link ProvisioningEngine} 기본 구현.
 *
 * <p>모든 상태 변경은 {@link EventSourcedRepository#update}를 통해 일어나며, 동시성 충돌은
 * {@link EngineConfig#maxConflictRetries()}번까지 다시 읽고 재적용합니다. 전역 락은 없습니다.</p>
 *
 * <p><strong>dispatch 흐름:</strong></p>
 * <pre>
 * 1. DispatchClaimed 기록 (pending 유지, 동시 dispatch 중 하나만 통과)
 * 2. 템플릿 해석 (실패 시 설정에 따라 기본 속성으로 대체하거나 failed)
 * 3. 전략 선택 (백엔드 capability + 가격 유형 + 템플릿 선호 목록 + 관측 지표)
 * 4. 보호 계층을 거쳐 provision
 * 5. running 전이와 핸들 기록 (또는 failed + 오류 종류)
 * </pre>
 *
 * <p><strong>reconcile 흐름:</strong></p>
 * <pre>
 * 1. 취소 표시 → 이미 만들어진 머신 terminate (best-effort) 후 failed(CANCELLED)
 * 2. 바인딩별 pollStatus
 * 3. 새 머신 연결 (요청 수 상한) 및 Machine upsert
 * 4. 완료 판단 → 아니면 타임아웃 판단
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class DefaultProvisioningEngine implements ProvisioningEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultProvisioningEngine.class);

    /**
     * 스팟 가격 템플릿을 처리하는 전략이 선언해야 하는 capability.
     */
    public static final String CAPABILITY_SPOT = "spot";

    /**
     * 혼합 가격 템플릿을 처리하는 전략이 선언해야 하는 capability.
     */
    public static final String CAPABILITY_HETEROGENEOUS = "heterogeneous";

    private final EventSourcedRepository<Request, RequestEvent> requests;
    private final EventSourcedRepository<Machine, MachineEvent> machines;
    private final ConfigSource templates;
    private final TemplateResolver resolver;
    private final StrategyRegistry registry;
    private final ResilientExecutor executor;
    private final IdGenerator idGenerator;
    private final Clock clock;
    private final EngineConfig config;

    private DefaultProvisioningEngine(Builder builder) {
        this.requests = builder.requests;
        this.machines = builder.machines;
        this.templates = builder.templates;
        this.resolver = builder.resolver;
        this.registry = builder.registry;
        this.idGenerator = builder.idGenerator;
        this.clock = builder.clock;
        this.config = builder.config;
        this.executor = builder.executor != null
            ? builder.executor
            : ResilientExecutor.builder()
                .timeoutPolicy(config.timeoutPolicy())
                .poolSize(config.backendPoolSize())
                .clock(clock)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ------------------------------------------------------------------ create

    @Override
    public RequestId create(TemplateId templateId, int count) {
        if (templateId == null) {
            throw new IllegalArgumentException("templateId cannot be null");
        }
        Template template = templates.loadTemplate(templateId)
            .orElseThrow(() -> new TemplateConfigurationException("Template not found: " + templateId));
        if (count <= 0) {
            throw new TemplateConfigurationException(
                "count must be positive (template: " + templateId + ", current: " + count + ")");
        }
        if (count > template.maxNumber()) {
            throw new TemplateConfigurationException(String.format(
                "count exceeds maxNumber of template %s (max: %d, current: %d)",
                templateId, template.maxNumber(), count));
        }

        RequestId requestId = RequestId.generate(RequestType.PROVISION, idGenerator.nextId());
        Request request = Request.create(requestId, RequestType.PROVISION, templateId, count, List.of(),
            idGenerator, now());
        requests.save(request, 0);
        log.info("Request {} created for template {} (count: {})", requestId, templateId, count);
        return requestId;
    }

    // ---------------------------------------------------------------- dispatch

    @Override
    public Request dispatch(RequestId requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        Request claimed = requests.update(requestId.getValue(), config.maxConflictRetries(),
            r -> r.proposeClaim(idGenerator, now()));
        if (claimed.type() != RequestType.PROVISION) {
            return fail(requestId, ErrorKind.INVALID_STATE, "Only provisioning requests can be dispatched");
        }

        Optional<Template> template = templates.loadTemplate(claimed.templateId());
        if (template.isEmpty()) {
            return fail(requestId, ErrorKind.CONFIGURATION, "Template not found: " + claimed.templateId());
        }

        ResolvedSpec spec;
        try {
            spec = resolve(template.get(), claimed);
        } catch (TemplateResolutionException e) {
            return fail(requestId, ErrorKind.RESOLUTION, e.getMessage());
        }

        SelectionCriteria criteria = criteriaFor(template.get());
        StrategyRegistration strategy;
        try {
            strategy = registry.select(criteria, executor.observations());
        } catch (NoSuitableStrategyException e) {
            Optional<String> open = openCircuitAmong(criteria, e);
            if (open.isPresent()) {
                CircuitOpenException unavailable = new CircuitOpenException(open.get());
                return fail(requestId, unavailable.getKind(), unavailable.getMessage());
            }
            return fail(requestId, e.getKind(), e.getMessage());
        }

        ProvisioningHandle handle;
        try {
            CloudBackend backend = strategy.backend();
            int count = claimed.requestedCount();
            handle = executor.execute(strategy.name(), BackendOperation.PROVISION,
                () -> backend.provision(spec, count));
        } catch (ProvisioningException e) {
            return fail(requestId, e.getKind(), e.getMessage());
        }

        BackendBinding binding = new BackendBinding(strategy.name(), handle);
        try {
            Request running = requests.update(requestId.getValue(), config.maxConflictRetries(),
                r -> r.proposeDispatched(List.of(binding), idGenerator, now()));
            log.info("Request {} dispatched to {} (handle: {})", requestId, strategy.name(), handle.handleId());
            return running;
        } catch (InvalidRequestStateException e) {
            // provision 도중 다른 경로(Reaper, 취소)가 Request를 종결함
            log.warn("Request {} settled while provisioning, releasing {}: {}", requestId, handle.handleId(),
                e.getMessage());
            terminateQuietly(strategy.name(), handle.resourceIds());
            return requests.load(requestId.getValue());
        }
    }

    private ResolvedSpec resolve(Template template, Request request) {
        try {
            return resolver.resolve(template, RuntimeContext.of(request, now()));
        } catch (TemplateResolutionException e) {
            if (!config.fallbackToBaseAttributes()) {
                throw e;
            }
            log.warn("Resolving template {} for {} failed, falling back to base attributes: {}",
                template.templateId(), request.id(), e.getMessage());
            return resolver.resolveBaseAttributes(template);
        }
    }

    private SelectionCriteria criteriaFor(Template template) {
        SelectionCriteria.Builder criteria = SelectionCriteria.builder()
            .requireCapability(template.backendType().getCapability())
            .requireHealthy(true)
            .prefer(template.strategyPreference())
            .minSuccessRate(config.minSuccessRate())
            .maxResponseTimeMs(config.maxResponseTimeMs());
        if (template.priceType() == PriceType.SPOT) {
            criteria.requireCapability(CAPABILITY_SPOT);
        } else if (template.priceType() == PriceType.HETEROGENEOUS) {
            criteria.requireCapability(CAPABILITY_HETEROGENEOUS);
        }
        return criteria.build();
    }

    /**
     * 건강 조건으로 후보가 모두 탈락했을 때, 그 원인이 열린 breaker인 전략 이름.
     */
    private Optional<String> openCircuitAmong(SelectionCriteria criteria, NoSuitableStrategyException e) {
        if (!"healthy".equals(e.getUnmetCriterion())) {
            return Optional.empty();
        }
        return registry.all().stream()
            .filter(r -> r.supports(criteria.requiredCapabilities()))
            .filter(r -> !criteria.excluded().contains(r.name()))
            .filter(r -> executor.breakerFor(r.name()).getState() == CircuitBreakerState.OPEN)
            .map(StrategyRegistration::name)
            .findFirst();
    }

    // --------------------------------------------------------------- reconcile

    @Override
    public Request reconcile(RequestId requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        Request request = requests.load(requestId.getValue());
        if (request.isTerminal()) {
            return request;
        }
        if (request.status() == RequestStatus.PENDING) {
            if (request.cancellationRequested() && request.dispatchClaimedAt() == null) {
                return fail(requestId, ErrorKind.CANCELLED, cancelledMessage(request));
            }
            return request;
        }
        if (request.cancellationRequested()) {
            return cancelRunning(request);
        }

        Instant now = now();
        Map<String, MachineStatusReport> observed = new LinkedHashMap<>();
        Map<String, String> strategyByResource = new LinkedHashMap<>();
        for (BackendBinding binding : request.bindings()) {
            List<MachineStatusReport> reports;
            try {
                CloudBackend backend = registry.get(binding.strategyName()).backend();
                BackendHandle handle = binding.handle();
                reports = executor.execute(binding.strategyName(), BackendOperation.POLL,
                    () -> backend.pollStatus(handle));
            } catch (ProvisioningException e) {
                log.warn("Polling {} for request {} failed: {}", binding.handle().handleId(), requestId,
                    e.getMessage());
                continue;
            }
            for (MachineStatusReport report : reports) {
                observed.put(report.resourceId(), report);
                strategyByResource.put(report.resourceId(), binding.strategyName());
            }
        }

        Request current = request;
        if (request.type() == RequestType.PROVISION && !observed.isEmpty()) {
            List<MachineId> observedIds = observed.keySet().stream()
                .map(MachineId::fromResourceId)
                .collect(Collectors.toList());
            current = requests.update(requestId.getValue(), config.maxConflictRetries(),
                r -> r.proposeAttach(observedIds, idGenerator, now));
        }

        for (MachineId machineId : current.machineIds()) {
            MachineStatusReport report = observed.get(machineId.resourceId());
            if (report != null) {
                upsertMachine(current, machineId, report, strategyByResource.get(report.resourceId()), now);
            }
        }

        List<Machine> related = loadMachines(current.machineIds());
        current = requests.update(requestId.getValue(), config.maxConflictRetries(),
            r -> r.proposeCompletion(related, idGenerator, now));
        if (!current.isTerminal()) {
            Duration timeout = Duration.ofMillis(config.requestTimeoutMs());
            current = requests.update(requestId.getValue(), config.maxConflictRetries(),
                r -> r.proposeTimeout(timeout, idGenerator, now));
        }
        if (current.isTerminal()) {
            log.info("Request {} is {} ({} machines){}", requestId, current.status().getWireValue(),
                current.machineIds().size(), current.message() == null ? "" : ": " + current.message());
        }
        return current;
    }

    private void upsertMachine(Request owner, MachineId machineId, MachineStatusReport report, String strategyName,
                               Instant now) {
        Optional<Machine> existing = machines.find(machineId.getValue());
        if (existing.isEmpty()) {
            if (owner.type() != RequestType.PROVISION) {
                log.warn("Return request {} observed unknown machine {}", owner.id(), machineId);
                return;
            }
            Machine registered = Machine.register(machineId, owner.id(), report.resourceId(), strategyName,
                idGenerator, now);
            registered = registered.record(registered.proposeObservation(report, idGenerator, now));
            try {
                machines.save(registered, 0);
                log.debug("Machine {} registered for {} ({})", machineId, owner.id(), report.status());
                return;
            } catch (ConcurrencyConflictException e) {
                log.debug("Machine {} was registered concurrently, applying observation instead", machineId);
            }
        }
        machines.update(machineId.getValue(), config.maxConflictRetries(),
            m -> unchanged(m, report) ? List.of() : m.proposeObservation(report, idGenerator, now));
    }

    private static boolean unchanged(Machine machine, MachineStatusReport report) {
        return machine.status() == report.status()
            && (report.name() == null || report.name().equals(machine.name()))
            && (report.privateIpAddress() == null || report.privateIpAddress().equals(machine.privateIpAddress()))
            && (report.publicIpAddress() == null || report.publicIpAddress().equals(machine.publicIpAddress()))
            && (report.launchTime() == null || report.launchTime().equals(machine.launchTime()))
            && (report.message() == null || report.message().equals(machine.message()));
    }

    private Request cancelRunning(Request request) {
        if (request.type() == RequestType.PROVISION) {
            Map<String, List<String>> toTerminate = new LinkedHashMap<>();
            for (Machine machine : loadMachines(request.machineIds())) {
                if (!machine.isTerminal() && machine.strategyName() != null) {
                    toTerminate.computeIfAbsent(machine.strategyName(), k -> new ArrayList<>())
                        .add(machine.resourceId());
                }
            }
            for (BackendBinding binding : request.bindings()) {
                List<String> resources = toTerminate.computeIfAbsent(binding.strategyName(), k -> new ArrayList<>());
                for (String resourceId : binding.handle().resourceIds()) {
                    if (!resources.contains(resourceId)) {
                        resources.add(resourceId);
                    }
                }
            }
            toTerminate.forEach(this::terminateQuietly);
        }
        return fail(request.id(), ErrorKind.CANCELLED, cancelledMessage(request));
    }

    private static String cancelledMessage(Request request) {
        return request.cancellationReason() == null
            ? "Request cancelled"
            : "Request cancelled: " + request.cancellationReason();
    }

    private void terminateQuietly(String strategyName, List<String> resourceIds) {
        if (resourceIds.isEmpty()) {
            return;
        }
        try {
            CloudBackend backend = registry.get(strategyName).backend();
            executor.execute(strategyName, BackendOperation.TERMINATE, () -> backend.terminate(resourceIds));
            log.info("Terminated {} machines on {}", resourceIds.size(), strategyName);
        } catch (ProvisioningException e) {
            log.warn("Best-effort terminate of {} on {} failed: {}", resourceIds, strategyName, e.getMessage());
        }
    }

    // ------------------------------------------------------------------ return

    @Override
    public RequestId returnMachines(List<MachineId> machineIds) {
        if (machineIds == null || machineIds.isEmpty()) {
            throw new IllegalArgumentException("machineIds cannot be null or empty");
        }
        List<Machine> targets = new ArrayList<>();
        for (MachineId machineId : new LinkedHashSet<>(machineIds)) {
            Machine machine = machines.load(machineId.getValue());
            if (machine.isTerminal()) {
                throw new InvalidMachineStateException(
                    "Machine " + machineId + " is already " + machine.status().getWireValue());
            }
            if (machine.returnRequestId() != null) {
                throw new InvalidMachineStateException(
                    "Machine " + machineId + " is already being returned by " + machine.returnRequestId());
            }
            targets.add(machine);
        }

        Instant now = now();
        RequestId returnId = RequestId.generate(RequestType.RETURN, idGenerator.nextId());
        List<MachineId> targetIds = targets.stream().map(Machine::id).collect(Collectors.toList());
        requests.save(Request.create(returnId, RequestType.RETURN, null, targets.size(), targetIds, idGenerator, now), 0);
        for (Machine target : targets) {
            machines.update(target.id().getValue(), config.maxConflictRetries(),
                m -> m.proposeReturn(returnId, idGenerator, now));
        }
        requests.update(returnId.getValue(), config.maxConflictRetries(), r -> r.proposeClaim(idGenerator, now));
        log.info("Return request {} created for {} machines", returnId, targets.size());

        Map<String, List<String>> byStrategy = new LinkedHashMap<>();
        for (Machine target : targets) {
            byStrategy.computeIfAbsent(Objects.requireNonNullElse(target.strategyName(), ""), k -> new ArrayList<>())
                .add(target.resourceId());
        }

        List<BackendBinding> bindings = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        ErrorKind failureKind = ErrorKind.PERMANENT_BACKEND;
        for (Map.Entry<String, List<String>> group : byStrategy.entrySet()) {
            String strategyName = group.getKey();
            List<String> resourceIds = group.getValue();
            try {
                CloudBackend backend = registry.get(strategyName).backend();
                TerminationHandle handle = executor.execute(strategyName, BackendOperation.TERMINATE,
                    () -> backend.terminate(resourceIds));
                bindings.add(new BackendBinding(strategyName, handle));
            } catch (ProvisioningException e) {
                failures.add(strategyName + ": " + e.getMessage());
                failureKind = e.getKind();
            }
        }

        if (bindings.isEmpty()) {
            fail(returnId, failureKind, "Terminate failed (" + String.join("; ", failures) + ")");
            return returnId;
        }
        if (!failures.isEmpty()) {
            log.error("Return request {} could not terminate every group: {}", returnId, failures);
        }
        requests.update(returnId.getValue(), config.maxConflictRetries(),
            r -> r.proposeDispatched(bindings, idGenerator, now()));
        log.info("Return request {} dispatched ({} termination handles)", returnId, bindings.size());
        return returnId;
    }

    // ------------------------------------------------------------------ cancel

    @Override
    public Request cancel(RequestId requestId, String reason) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        Request marked = requests.update(requestId.getValue(), config.maxConflictRetries(),
            r -> r.proposeCancellation(reason, idGenerator, now()));
        log.info("Request {} marked for cancellation{}", requestId, reason == null ? "" : ": " + reason);
        return marked;
    }

    // ----------------------------------------------------------------- queries

    @Override
    public Request getRequest(RequestId requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        return requests.load(requestId.getValue());
    }

    @Override
    public List<Machine> getMachines(RequestId requestId) {
        return loadMachines(getRequest(requestId).machineIds());
    }

    @Override
    public List<Machine> listMachines() {
        List<Machine> result = new ArrayList<>();
        for (String id : machines.ids()) {
            machines.find(id).ifPresent(result::add);
        }
        return result;
    }

    @Override
    public List<RequestId> activeRequestIds() {
        List<RequestId> result = new ArrayList<>();
        for (String id : requests.ids()) {
            requests.find(id)
                .filter(r -> !r.isTerminal())
                .ifPresent(r -> result.add(r.id()));
        }
        return result;
    }

    @Override
    public List<Template> listTemplates() {
        return templates.loadTemplates();
    }

    public ResilientExecutor executor() {
        return executor;
    }

    public EngineConfig config() {
        return config;
    }

    // ----------------------------------------------------------------- helpers

    private List<Machine> loadMachines(List<MachineId> machineIds) {
        List<Machine> result = new ArrayList<>(machineIds.size());
        for (MachineId machineId : machineIds) {
            machines.find(machineId.getValue()).ifPresent(result::add);
        }
        return result;
    }

    private Request fail(RequestId requestId, ErrorKind kind, String message) {
        Request failed = requests.update(requestId.getValue(), config.maxConflictRetries(),
            r -> r.proposeFailure(message, kind, idGenerator, now()));
        log.warn("Request {} failed ({}): {}", requestId, kind, message);
        return failed;
    }

    private Instant now() {
        return clock.instant();
    }

    public static final class Builder {

        private EventSourcedRepository<Request, RequestEvent> requests;
        private EventSourcedRepository<Machine, MachineEvent> machines;
        private ConfigSource templates;
        private TemplateResolver resolver;
        private StrategyRegistry registry;
        private ResilientExecutor executor;
        private IdGenerator idGenerator = new UuidIdGenerator();
        private Clock clock = Clock.systemUTC();
        private EngineConfig config = new EngineConfig();

        private Builder() {
        }

        public Builder requests(EventSourcedRepository<Request, RequestEvent> requests) {
            this.requests = requests;
            return this;
        }

        public Builder machines(EventSourcedRepository<Machine, MachineEvent> machines) {
            this.machines = machines;
            return this;
        }

        public Builder templates(ConfigSource templates) {
            this.templates = templates;
            return this;
        }

        public Builder resolver(TemplateResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder registry(StrategyRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * 보호 계층 (지정하지 않으면 {@link EngineConfig}의 타임아웃과 풀 크기로 생성).
         */
        public Builder executor(ResilientExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder idGenerator(IdGenerator idGenerator) {
            this.idGenerator = idGenerator;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        public DefaultProvisioningEngine build() {
            if (requests == null) {
                throw new IllegalArgumentException("requests cannot be null");
            }
            if (machines == null) {
                throw new IllegalArgumentException("machines cannot be null");
            }
            if (templates == null) {
                throw new IllegalArgumentException("templates cannot be null");
            }
            if (resolver == null) {
                throw new IllegalArgumentException("resolver cannot be null");
            }
            if (registry == null) {
                throw new IllegalArgumentException("registry cannot be null");
            }
            if (idGenerator == null) {
                throw new IllegalArgumentException("idGenerator cannot be null");
            }
            if (clock == null) {
                throw new IllegalArgumentException("clock cannot be null");
            }
            if (config == null) {
                throw new IllegalArgumentException("config cannot be null");
            }
            return new DefaultProvisioningEngine(this);
        }
    }
}
