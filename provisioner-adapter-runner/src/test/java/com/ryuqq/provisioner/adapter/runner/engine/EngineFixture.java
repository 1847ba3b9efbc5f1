package com.ryuqq.provisioner.adapter.runner.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.provisioner.adapter.inmemory.store.InMemoryEventStore;
import com.ryuqq.provisioner.adapter.runner.resilience.CircuitBreakerConfig;
import com.ryuqq.provisioner.adapter.runner.resilience.ResilientExecutor;
import com.ryuqq.provisioner.adapter.runner.resilience.RetryPolicy;
import com.ryuqq.provisioner.adapter.template.resolver.DefaultTemplateResolver;
import com.ryuqq.provisioner.adapter.template.resolver.ResolverConfig;
import com.ryuqq.provisioner.core.event.MachineEvent;
import com.ryuqq.provisioner.core.event.RequestEvent;
import com.ryuqq.provisioner.core.exception.SpecFileNotFoundException;
import com.ryuqq.provisioner.core.model.BackendType;
import com.ryuqq.provisioner.core.model.Machine;
import com.ryuqq.provisioner.core.model.PriceType;
import com.ryuqq.provisioner.core.model.Request;
import com.ryuqq.provisioner.core.model.Template;
import com.ryuqq.provisioner.core.model.TemplateId;
import com.ryuqq.provisioner.core.repository.AggregateTypes;
import com.ryuqq.provisioner.core.repository.EventSourcedRepository;
import com.ryuqq.provisioner.core.spi.ConfigSource;
import com.ryuqq.provisioner.core.strategy.StrategyRegistration;
import com.ryuqq.provisioner.core.strategy.StrategyRegistry;
import com.ryuqq.provisioner.testkit.fixture.MutableClock;
import com.ryuqq.provisioner.testkit.fixture.ScriptedCloudBackend;
import com.ryuqq.provisioner.testkit.fixture.SequentialIdGenerator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 엔진 테스트용 구성.
 *
 * <p>인메모리 저장소, 실제 템플릿 해석기, 스크립트 가능한 백엔드("compute")로 엔진을 조립합니다.
 * backoff 대기는 기록만 하고 잠들지 않습니다.</p>
 */
public final class EngineFixture implements AutoCloseable {

    public static final String ONDEMAND_TEMPLATE = "tpl-ondemand";
    public static final String SPOT_TEMPLATE = "tpl-spot";
    public static final String BROKEN_TEMPLATE = "tpl-broken";

    public final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    public final SequentialIdGenerator ids = new SequentialIdGenerator();
    public final EventSourcedRepository<Request, RequestEvent> requests =
        new EventSourcedRepository<>(new InMemoryEventStore<RequestEvent, Request>(), AggregateTypes.REQUEST);
    public final EventSourcedRepository<Machine, MachineEvent> machines =
        new EventSourcedRepository<>(new InMemoryEventStore<MachineEvent, Machine>(), AggregateTypes.MACHINE);
    public final Map<TemplateId, Template> templates = new LinkedHashMap<>();
    public final StrategyRegistry registry = new StrategyRegistry();
    public final ScriptedCloudBackend compute = new ScriptedCloudBackend("compute", BackendType.RUN_INSTANCES);
    public final List<Long> sleeps = new ArrayList<>();
    public final ResilientExecutor executor;
    public final DefaultProvisioningEngine engine;

    public EngineFixture() {
        this(new EngineConfig(), new CircuitBreakerConfig());
    }

    public EngineFixture(EngineConfig config, CircuitBreakerConfig breakerConfig) {
        addTemplate(Template.builder(ONDEMAND_TEMPLATE, BackendType.RUN_INSTANCES)
            .imageId("ami-1")
            .instanceType("t3.medium")
            .maxNumber(10)
            .build());
        addTemplate(Template.builder(SPOT_TEMPLATE, BackendType.RUN_INSTANCES)
            .imageId("ami-1")
            .instanceType("t3.medium")
            .priceType(PriceType.SPOT)
            .build());
        addTemplate(Template.builder(BROKEN_TEMPLATE, BackendType.RUN_INSTANCES)
            .imageId("ami-1")
            .instanceType("t3.medium")
            .providerSpec(Map.of("InstanceType", "{{ undefined_size }}"))
            .build());

        registry.register(new StrategyRegistration("compute", compute, Set.of("compute"), 10));

        ConfigSource configSource = new ConfigSource() {
            @Override
            public Optional<Template> loadTemplate(TemplateId templateId) {
                return Optional.ofNullable(templates.get(templateId));
            }

            @Override
            public List<Template> loadTemplates() {
                return List.copyOf(templates.values());
            }

            @Override
            public String loadRawSpec(String path) {
                throw new SpecFileNotFoundException("No spec files in tests: " + path);
            }
        };

        executor = ResilientExecutor.builder()
            .retryPolicy(new RetryPolicy(3, 10, 2.0, 100))
            .circuitBreakerConfig(breakerConfig)
            .timeoutPolicy(config.timeoutPolicy())
            .sleeper(sleeps::add)
            .clock(clock)
            .poolSize(2)
            .build();

        engine = DefaultProvisioningEngine.builder()
            .requests(requests)
            .machines(machines)
            .templates(configSource)
            .resolver(new DefaultTemplateResolver(configSource, new ResolverConfig(), new ObjectMapper()))
            .registry(registry)
            .executor(executor)
            .idGenerator(ids)
            .clock(clock)
            .config(config)
            .build();
    }

    public void addTemplate(Template template) {
        templates.put(template.templateId(), template);
    }

    /**
     * dispatch된 Request의 첫 번째 백엔드 핸들 ID.
     */
    public String handleOf(Request request) {
        return request.bindings().get(0).handle().handleId();
    }

    @Override
    public void close() {
        executor.close();
    }
}
