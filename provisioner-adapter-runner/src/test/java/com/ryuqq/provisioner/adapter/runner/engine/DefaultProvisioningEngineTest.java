package com.ryuqq.provisioner.adapter.runner.engine;

import com.ryuqq.provisioner.adapter.runner.resilience.CircuitBreakerConfig;
import com.ryuqq.provisioner.core.exception.ErrorKind;
import com.ryuqq.provisioner.core.exception.InvalidMachineStateException;
import com.ryuqq.provisioner.core.exception.InvalidRequestStateException;
import com.ryuqq.provisioner.core.exception.PermanentBackendException;
import com.ryuqq.provisioner.core.exception.TemplateConfigurationException;
import com.ryuqq.provisioner.core.exception.TransientBackendException;
import com.ryuqq.provisioner.core.model.BackendType;
import com.ryuqq.provisioner.core.model.Machine;
import com.ryuqq.provisioner.core.model.MachineId;
import com.ryuqq.provisioner.core.model.MachineResult;
import com.ryuqq.provisioner.core.model.MachineStatus;
import com.ryuqq.provisioner.core.model.Request;
import com.ryuqq.provisioner.core.model.RequestId;
import com.ryuqq.provisioner.core.model.RequestStatus;
import com.ryuqq.provisioner.core.model.RequestType;
import com.ryuqq.provisioner.core.model.Template;
import com.ryuqq.provisioner.core.model.TemplateId;
import com.ryuqq.provisioner.core.protection.CircuitBreakerState;
import com.ryuqq.provisioner.core.spi.BackendHandle;
import com.ryuqq.provisioner.core.spi.CloudBackend;
import com.ryuqq.provisioner.core.spi.HealthState;
import com.ryuqq.provisioner.core.spi.MachineStatusReport;
import com.ryuqq.provisioner.core.spi.ProvisioningHandle;
import com.ryuqq.provisioner.core.spi.TerminationHandle;
import com.ryuqq.provisioner.core.strategy.StrategyRegistration;
import com.ryuqq.provisioner.core.template.ResolvedSpec;
import com.ryuqq.provisioner.testkit.fixture.ScriptedCloudBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static com.ryuqq.provisioner.adapter.runner.engine.EngineFixture.BROKEN_TEMPLATE;
import static com.ryuqq.provisioner.adapter.runner.engine.EngineFixture.ONDEMAND_TEMPLATE;
import static com.ryuqq.provisioner.adapter.runner.engine.EngineFixture.SPOT_TEMPLATE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DefaultProvisioningEngine 테스트.
 *
 * <p>인메모리 저장소와 스크립트 백엔드로 Request 생명주기 전체를 검증합니다:</p>
 * <ul>
 *   <li>create / dispatch / reconcile 상태 전이</li>
 *   <li>dispatch 멱등성과 동시 dispatch</li>
 *   <li>백엔드 오류 분류 (일시적, 영구, breaker 열림)</li>
 *   <li>취소, 타임아웃, 머신 반환</li>
 * </ul>
 */
class DefaultProvisioningEngineTest {

    private EngineFixture fx;
    private DefaultProvisioningEngine engine;

    @BeforeEach
    void setUp() {
        fx = new EngineFixture();
        engine = fx.engine;
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    private RequestId create(int count) {
        return engine.create(TemplateId.of(ONDEMAND_TEMPLATE), count);
    }

    private Request dispatchAndReport(RequestId requestId, int observed, MachineStatus status) {
        Request running = engine.dispatch(requestId);
        fx.compute.reportAll(fx.handleOf(running), observed, status);
        return engine.reconcile(requestId);
    }

    // ============================================================
    // 1. create
    // ============================================================

    @Test
    void create는_pending_Request를_저장한다() {
        // when
        RequestId requestId = create(3);

        // then
        Request request = engine.getRequest(requestId);
        assertThat(requestId.getValue()).startsWith("req-");
        assertThat(request.status()).isEqualTo(RequestStatus.PENDING);
        assertThat(request.type()).isEqualTo(RequestType.PROVISION);
        assertThat(request.requestedCount()).isEqualTo(3);
        assertThat(request.machineIds()).isEmpty();
        assertThat(request.version()).isEqualTo(1);
    }

    @Test
    void create는_템플릿_maxNumber를_넘는_요청을_저장하지_않는다() {
        // when & then
        assertThatThrownBy(() -> create(11))
            .isInstanceOf(TemplateConfigurationException.class)
            .hasMessageContaining("maxNumber");
        assertThat(fx.requests.ids()).isEmpty();
    }

    @Test
    void create는_없는_템플릿과_양수가_아닌_수를_거부한다() {
        // when & then
        assertThatThrownBy(() -> engine.create(TemplateId.of("tpl-missing"), 1))
            .isInstanceOf(TemplateConfigurationException.class)
            .hasMessageContaining("Template not found");
        assertThatThrownBy(() -> create(0))
            .isInstanceOf(TemplateConfigurationException.class)
            .hasMessageContaining("count must be positive");
    }

    // ============================================================
    // 2. dispatch
    // ============================================================

    @Test
    void dispatch는_Request를_running으로_바꾸고_백엔드_핸들을_기록한다() {
        // given
        RequestId requestId = create(2);

        // when
        Request request = engine.dispatch(requestId);

        // then
        assertThat(request.status()).isEqualTo(RequestStatus.RUNNING);
        assertThat(request.dispatchedAt()).isNotNull();
        assertThat(request.bindings()).hasSize(1);
        assertThat(request.bindings().get(0).strategyName()).isEqualTo("compute");
        assertThat(fx.compute.provisionCalls()).isEqualTo(1);
        ResolvedSpec spec = fx.compute.provisionedSpecs().get(0);
        assertThat(spec.payload()).containsEntry("ImageId", "ami-1").containsEntry("InstanceType", "t3.medium");
    }

    @Test
    void 이미_dispatch된_Request를_다시_dispatch하면_상태_변화_없이_거부된다() {
        // given
        RequestId requestId = create(1);
        engine.dispatch(requestId);
        long version = engine.getRequest(requestId).version();

        // when & then
        assertThatThrownBy(() -> engine.dispatch(requestId))
            .isInstanceOf(InvalidRequestStateException.class);
        assertThat(engine.getRequest(requestId).version()).isEqualTo(version);
        assertThat(fx.compute.provisionCalls()).isEqualTo(1);
    }

    @Test
    void 동시에_dispatch해도_백엔드는_한_번만_호출된다() throws Exception {
        // given
        RequestId requestId = create(1);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger rejected = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                try {
                    engine.dispatch(requestId);
                } catch (InvalidRequestStateException e) {
                    rejected.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // then
        assertThat(fx.compute.provisionCalls()).isEqualTo(1);
        assertThat(rejected.get()).isEqualTo(threads - 1);
        assertThat(engine.getRequest(requestId).status()).isEqualTo(RequestStatus.RUNNING);
    }

    @Test
    void 일시적_오류는_재시도_후_성공한다() {
        // given
        fx.compute.failNextProvision(new TransientBackendException("RequestLimitExceeded"));
        RequestId requestId = create(1);

        // when
        Request request = engine.dispatch(requestId);

        // then
        assertThat(request.status()).isEqualTo(RequestStatus.RUNNING);
        assertThat(fx.compute.provisionCalls()).isEqualTo(2);
        assertThat(fx.sleeps).containsExactly(10L);
    }

    @Test
    void 영구_오류는_재시도_없이_failed로_기록된다() {
        // given
        fx.compute.failNextProvision(new PermanentBackendException("InvalidParameterValue: ami-1"));
        RequestId requestId = create(1);

        // when
        Request request = engine.dispatch(requestId);

        // then
        assertThat(request.status()).isEqualTo(RequestStatus.FAILED);
        assertThat(request.errorKind()).isEqualTo(ErrorKind.PERMANENT_BACKEND);
        assertThat(request.message()).contains("InvalidParameterValue");
        assertThat(fx.compute.provisionCalls()).isEqualTo(1);
    }

    @Test
    void 재시도를_모두_소진하면_일시적_오류로_failed된다() {
        // given
        fx.compute.failAlways(new TransientBackendException("ServiceUnavailable"));
        RequestId requestId = create(1);

        // when
        Request request = engine.dispatch(requestId);

        // then
        assertThat(request.status()).isEqualTo(RequestStatus.FAILED);
        assertThat(request.errorKind()).isEqualTo(ErrorKind.TRANSIENT_BACKEND);
        assertThat(request.message()).contains("failed after 3 attempts");
        assertThat(fx.compute.provisionCalls()).isEqualTo(3);
    }

    @Test
    void breaker가_열리면_백엔드_일시_사용_불가로_failed된다() {
        // given
        fx.close();
        fx = new EngineFixture(new EngineConfig(), new CircuitBreakerConfig(2, 30000, 1));
        engine = fx.engine;
        fx.compute.failAlways(new TransientBackendException("ServiceUnavailable"));

        // when
        Request first = engine.dispatch(create(1));
        Request second = engine.dispatch(create(1));

        // then
        assertThat(first.status()).isEqualTo(RequestStatus.FAILED);
        assertThat(first.errorKind()).isEqualTo(ErrorKind.BACKEND_UNAVAILABLE);
        assertThat(second.errorKind()).isEqualTo(ErrorKind.BACKEND_UNAVAILABLE);
        assertThat(second.message()).startsWith("Backend temporarily unavailable");
        assertThat(fx.compute.provisionCalls()).isEqualTo(2);
    }

    @Test
    void 복구_시간이_지나면_열린_breaker의_전략으로_다시_dispatch한다() {
        // given
        fx.close();
        fx = new EngineFixture(new EngineConfig(), new CircuitBreakerConfig(2, 30000, 1));
        engine = fx.engine;
        fx.compute.failAlways(new TransientBackendException("ServiceUnavailable"));
        engine.dispatch(create(1));
        assertThat(fx.executor.breakerFor("compute").getState()).isEqualTo(CircuitBreakerState.OPEN);
        fx.compute.failAlways(null);

        // when
        fx.clock.advanceMillis(30000);
        Request request = engine.dispatch(create(1));

        // then
        assertThat(request.status()).isEqualTo(RequestStatus.RUNNING);
        assertThat(fx.compute.provisionCalls()).isEqualTo(3);
        assertThat(fx.executor.breakerFor("compute").getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void 복구_시간_전에는_열린_breaker의_전략을_호출하지_않는다() {
        // given
        fx.close();
        fx = new EngineFixture(new EngineConfig(), new CircuitBreakerConfig(2, 30000, 1));
        engine = fx.engine;
        fx.compute.failAlways(new TransientBackendException("ServiceUnavailable"));
        engine.dispatch(create(1));
        fx.compute.failAlways(null);

        // when
        fx.clock.advanceMillis(29999);
        Request request = engine.dispatch(create(1));

        // then
        assertThat(request.errorKind()).isEqualTo(ErrorKind.BACKEND_UNAVAILABLE);
        assertThat(fx.compute.provisionCalls()).isEqualTo(2);
    }

    @Test
    void 성공률이_기준보다_낮은_전략은_우선순위가_높아도_뒤로_밀린다() {
        // given
        ScriptedCloudBackend steady = new ScriptedCloudBackend("steady", BackendType.RUN_INSTANCES);
        fx.registry.register(new StrategyRegistration("steady", steady, Set.of("compute"), 1));
        fx.executor.metrics().recordCall("compute", true, 50);
        fx.executor.metrics().recordCall("compute", false, 50);
        fx.executor.metrics().recordCall("compute", false, 50);

        // when
        Request request = engine.dispatch(create(1));

        // then
        assertThat(request.bindings().get(0).strategyName()).isEqualTo("steady");
        assertThat(fx.compute.provisionCalls()).isZero();
    }

    @Test
    void 평균_응답_시간이_기준을_넘는_전략은_우선순위가_높아도_뒤로_밀린다() {
        // given
        fx.close();
        fx = new EngineFixture(new EngineConfig().withSelectionThresholds(0.95, 2000), new CircuitBreakerConfig());
        engine = fx.engine;
        ScriptedCloudBackend fast = new ScriptedCloudBackend("fast", BackendType.RUN_INSTANCES);
        fx.registry.register(new StrategyRegistration("fast", fast, Set.of("compute"), 1));
        fx.executor.metrics().recordCall("compute", true, 4000);
        fx.executor.metrics().recordCall("fast", true, 300);

        // when
        Request request = engine.dispatch(create(1));

        // then
        assertThat(request.bindings().get(0).strategyName()).isEqualTo("fast");
        assertThat(fast.provisionCalls()).isEqualTo(1);
    }

    @Test
    void 템플릿_해석이_실패하면_백엔드를_호출하지_않고_failed된다() {
        // given
        RequestId requestId = engine.create(TemplateId.of(BROKEN_TEMPLATE), 1);

        // when
        Request request = engine.dispatch(requestId);

        // then
        assertThat(request.status()).isEqualTo(RequestStatus.FAILED);
        assertThat(request.errorKind()).isEqualTo(ErrorKind.RESOLUTION);
        assertThat(fx.compute.provisionCalls()).isZero();
    }

    @Test
    void 기본_속성_대체가_켜져_있으면_해석_실패_시_기본_속성으로_진행한다() {
        // given
        try (EngineFixture fallback = new EngineFixture(
            new EngineConfig().withFallbackToBaseAttributes(true), new CircuitBreakerConfig())) {
            RequestId requestId = fallback.engine.create(TemplateId.of(BROKEN_TEMPLATE), 1);

            // when
            Request request = fallback.engine.dispatch(requestId);

            // then
            assertThat(request.status()).isEqualTo(RequestStatus.RUNNING);
            ResolvedSpec spec = fallback.compute.provisionedSpecs().get(0);
            assertThat(spec.baseAttributesOnly()).isTrue();
            assertThat(spec.payload()).containsEntry("InstanceType", "t3.medium");
        }
    }

    @Test
    void 가격_유형을_처리할_전략이_없으면_NO_SUITABLE_STRATEGY로_failed된다() {
        // given
        RequestId requestId = engine.create(TemplateId.of(SPOT_TEMPLATE), 1);

        // when
        Request request = engine.dispatch(requestId);

        // then
        assertThat(request.status()).isEqualTo(RequestStatus.FAILED);
        assertThat(request.errorKind()).isEqualTo(ErrorKind.NO_SUITABLE_STRATEGY);
        assertThat(fx.compute.provisionCalls()).isZero();
    }

    @Test
    void 스팟_템플릿은_spot_capability를_가진_전략으로_간다() {
        // given
        ScriptedCloudBackend spot = new ScriptedCloudBackend("spot", BackendType.RUN_INSTANCES);
        fx.registry.register(new StrategyRegistration("spot", spot,
            Set.of("compute", DefaultProvisioningEngine.CAPABILITY_SPOT), 1));

        // when
        Request request = engine.dispatch(engine.create(TemplateId.of(SPOT_TEMPLATE), 1));

        // then
        assertThat(request.bindings().get(0).strategyName()).isEqualTo("spot");
        assertThat(spot.provisionCalls()).isEqualTo(1);
        assertThat(fx.compute.provisionCalls()).isZero();
    }

    @Test
    void 템플릿의_전략_선호_순서가_우선순위보다_앞선다() {
        // given
        ScriptedCloudBackend secondary = new ScriptedCloudBackend("secondary", BackendType.RUN_INSTANCES);
        fx.registry.register(new StrategyRegistration("secondary", secondary, Set.of("compute"), 1));
        fx.addTemplate(Template.builder("tpl-preferred", BackendType.RUN_INSTANCES)
            .imageId("ami-1")
            .instanceType("t3.small")
            .strategyPreference(List.of("secondary"))
            .build());

        // when
        Request request = engine.dispatch(engine.create(TemplateId.of("tpl-preferred"), 1));

        // then
        assertThat(request.bindings().get(0).strategyName()).isEqualTo("secondary");
    }

    @Test
    void provision_도중_Request가_종결되면_만들어진_자원을_정리한다() {
        // given
        AtomicReference<RequestId> target = new AtomicReference<>();
        ScriptedCloudBackend cleanup = new ScriptedCloudBackend("racing", BackendType.RUN_INSTANCES);
        CloudBackend racing = new CloudBackend() {
            @Override
            public ProvisioningHandle provision(ResolvedSpec spec, int count) {
                fx.requests.update(target.get().getValue(), 3,
                    r -> r.proposeFailure("failed elsewhere", ErrorKind.TIMEOUT, fx.ids, fx.clock.instant()));
                return new ProvisioningHandle("racing-1", BackendType.RUN_INSTANCES, count, List.of("i-orphan"),
                    Map.of());
            }

            @Override
            public List<MachineStatusReport> pollStatus(BackendHandle handle) {
                return List.of();
            }

            @Override
            public TerminationHandle terminate(List<String> resourceIds) {
                return cleanup.terminate(resourceIds);
            }

            @Override
            public HealthState healthCheck() {
                return HealthState.HEALTHY;
            }
        };
        fx.registry.register(new StrategyRegistration("racing", racing, Set.of("compute"), 100));
        target.set(create(1));

        // when
        Request request = engine.dispatch(target.get());

        // then
        assertThat(request.status()).isEqualTo(RequestStatus.FAILED);
        assertThat(request.message()).isEqualTo("failed elsewhere");
        assertThat(cleanup.terminatedBatches()).containsExactly(List.of("i-orphan"));
    }

    // ============================================================
    // 3. reconcile
    // ============================================================

    @Test
    void 요청한_머신이_모두_running이면_completed가_된다() {
        // given
        RequestId requestId = create(5);

        // when
        Request request = dispatchAndReport(requestId, 5, MachineStatus.RUNNING);

        // then
        assertThat(request.status()).isEqualTo(RequestStatus.COMPLETED);
        assertThat(request.completedAt()).isNotNull();
        List<Machine> machines = engine.getMachines(requestId);
        assertThat(machines).hasSize(5);
        assertThat(machines).allSatisfy(m -> {
            assertThat(m.result()).isEqualTo(MachineResult.SUCCEED);
            assertThat(m.status()).isEqualTo(MachineStatus.RUNNING);
            assertThat(m.requestId()).isEqualTo(requestId);
            assertThat(m.strategyName()).isEqualTo("compute");
        });
        Machine first = machines.get(0);
        assertThat(first.id().getValue()).isEqualTo("m-" + first.resourceId());
        assertThat(first.name()).isEqualTo("host-1");
        assertThat(first.privateIpAddress()).isEqualTo("10.0.0.1");
    }

    @Test
    void 일부만_관측되면_running을_유지한다() {
        // when
        Request request = dispatchAndReport(create(5), 3, MachineStatus.RUNNING);

        // then
        assertThat(request.status()).isEqualTo(RequestStatus.RUNNING);
        assertThat(request.machineIds()).hasSize(3);
    }

    @Test
    void 요청_수를_넘는_머신은_연결하지_않는다() {
        // when
        Request request = dispatchAndReport(create(2), 3, MachineStatus.RUNNING);

        // then
        assertThat(request.status()).isEqualTo(RequestStatus.COMPLETED);
        assertThat(request.machineIds()).hasSize(2);
        assertThat(fx.machines.ids()).hasSize(2);
    }

    @Test
    void pending_머신은_결과가_확정될_때까지_기다린다() {
        // given
        RequestId requestId = create(2);
        Request pending = dispatchAndReport(requestId, 2, MachineStatus.PENDING);
        assertThat(pending.status()).isEqualTo(RequestStatus.RUNNING);
        assertThat(engine.getMachines(requestId))
            .extracting(Machine::result)
            .containsOnly(MachineResult.EXECUTING);

        // when
        fx.compute.reportAll(fx.handleOf(pending), 2, MachineStatus.RUNNING);
        Request request = engine.reconcile(requestId);

        // then
        assertThat(request.status()).isEqualTo(RequestStatus.COMPLETED);
    }

    @Test
    void 실패한_머신이_있으면_completed_with_error가_된다() {
        // given
        RequestId requestId = create(2);
        Request running = engine.dispatch(requestId);
        String handle = fx.handleOf(running);
        fx.compute.report(handle, List.of(
            new MachineStatusReport(handle + "-i-1", MachineStatus.RUNNING, "host-1", "10.0.0.1", null, null, null),
            new MachineStatusReport(handle + "-i-2", MachineStatus.FAILED, null, null, null, null,
                "InsufficientInstanceCapacity")));

        // when
        Request request = engine.reconcile(requestId);

        // then
        assertThat(request.status()).isEqualTo(RequestStatus.COMPLETED_WITH_ERROR);
        assertThat(request.message()).contains("1 of 2 machines failed");
        assertThat(engine.getMachines(requestId))
            .extracting(Machine::result)
            .containsExactly(MachineResult.SUCCEED, MachineResult.FAIL);
    }

    @Test
    void 변화가_없는_관측은_머신_이벤트를_남기지_않는다() {
        // given
        RequestId requestId = create(3);
        dispatchAndReport(requestId, 2, MachineStatus.RUNNING);
        Map<MachineId, Long> versions = engine.getMachines(requestId).stream()
            .collect(Collectors.toMap(Machine::id, Machine::version));

        // when
        engine.reconcile(requestId);

        // then
        assertThat(fx.compute.pollCalls()).isEqualTo(2);
        assertThat(engine.getMachines(requestId)).allSatisfy(m ->
            assertThat(m.version()).isEqualTo(versions.get(m.id())));
    }

    @Test
    void running_허용_시간을_넘기면_timeout으로_completed_with_error가_된다() {
        // given
        RequestId requestId = create(3);
        dispatchAndReport(requestId, 1, MachineStatus.RUNNING);

        // when
        fx.clock.advance(Duration.ofHours(1).plusSeconds(1));
        Request request = engine.reconcile(requestId);

        // then
        assertThat(request.status()).isEqualTo(RequestStatus.COMPLETED_WITH_ERROR);
        assertThat(request.errorKind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(request.machineIds()).hasSize(1);
    }

    @Test
    void 종료된_Request의_reconcile은_아무것도_하지_않는다() {
        // given
        RequestId requestId = create(1);
        Request completed = dispatchAndReport(requestId, 1, MachineStatus.RUNNING);
        int polls = fx.compute.pollCalls();

        // when
        Request again = engine.reconcile(requestId);

        // then
        assertThat(again.version()).isEqualTo(completed.version());
        assertThat(fx.compute.pollCalls()).isEqualTo(polls);
    }

    @Test
    void poll이_실패해도_Request는_running을_유지한다() {
        // given
        RequestId requestId = create(1);
        engine.dispatch(requestId);
        fx.compute.failAlways(new PermanentBackendException("DescribeInstances denied"));

        // when
        Request request = engine.reconcile(requestId);

        // then
        assertThat(request.status()).isEqualTo(RequestStatus.RUNNING);
        assertThat(request.machineIds()).isEmpty();
    }

    // ============================================================
    // 4. cancel
    // ============================================================

    @Test
    void dispatch_전에_취소하면_백엔드를_호출하지_않고_cancelled로_failed된다() {
        // given
        RequestId requestId = create(1);

        // when
        engine.cancel(requestId, "no longer needed");

        // then
        assertThatThrownBy(() -> engine.dispatch(requestId))
            .isInstanceOf(InvalidRequestStateException.class);
        Request request = engine.reconcile(requestId);
        assertThat(request.status()).isEqualTo(RequestStatus.FAILED);
        assertThat(request.errorKind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(fx.compute.provisionCalls()).isZero();
    }

    @Test
    void running_Request를_취소하면_만들어진_머신을_terminate하고_failed된다() {
        // given
        RequestId requestId = create(3);
        Request running = dispatchAndReport(requestId, 2, MachineStatus.RUNNING);
        String handle = fx.handleOf(running);

        // when
        engine.cancel(requestId, "user abort");
        Request request = engine.reconcile(requestId);

        // then
        assertThat(request.status()).isEqualTo(RequestStatus.FAILED);
        assertThat(request.errorKind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(request.message()).contains("user abort");
        assertThat(fx.compute.terminatedBatches()).hasSize(1);
        assertThat(fx.compute.terminatedBatches().get(0))
            .containsExactlyInAnyOrder(handle + "-i-1", handle + "-i-2");
    }

    @Test
    void 종료된_Request는_취소할_수_없다() {
        // given
        RequestId requestId = create(1);
        dispatchAndReport(requestId, 1, MachineStatus.RUNNING);

        // when & then
        assertThatThrownBy(() -> engine.cancel(requestId, "too late"))
            .isInstanceOf(InvalidRequestStateException.class);
    }

    // ============================================================
    // 5. returnMachines
    // ============================================================

    @Test
    void 머신_반환은_ret_Request를_만들고_terminate_후_completed가_된다() {
        // given
        RequestId requestId = create(2);
        dispatchAndReport(requestId, 2, MachineStatus.RUNNING);
        List<MachineId> machineIds = engine.getRequest(requestId).machineIds();

        // when
        RequestId returnId = engine.returnMachines(machineIds);

        // then
        Request returning = engine.getRequest(returnId);
        assertThat(returnId.getValue()).startsWith("ret-");
        assertThat(returning.type()).isEqualTo(RequestType.RETURN);
        assertThat(returning.status()).isEqualTo(RequestStatus.RUNNING);
        assertThat(engine.getMachines(requestId))
            .extracting(Machine::returnRequestId)
            .containsOnly(returnId);
        assertThat(fx.compute.terminatedBatches().get(0))
            .containsExactlyInAnyOrderElementsOf(machineIds.stream().map(MachineId::resourceId).collect(Collectors.toList()));

        Request completed = engine.reconcile(returnId);
        assertThat(completed.status()).isEqualTo(RequestStatus.COMPLETED);
        assertThat(engine.getMachines(requestId))
            .extracting(Machine::status)
            .containsOnly(MachineStatus.TERMINATED);
    }

    @Test
    void 이미_반환_중인_머신은_다시_반환할_수_없다() {
        // given
        RequestId requestId = create(1);
        dispatchAndReport(requestId, 1, MachineStatus.RUNNING);
        List<MachineId> machineIds = engine.getRequest(requestId).machineIds();
        engine.returnMachines(machineIds);

        // when & then
        assertThatThrownBy(() -> engine.returnMachines(machineIds))
            .isInstanceOf(InvalidMachineStateException.class)
            .hasMessageContaining("already being returned");
        assertThat(fx.compute.terminateCalls()).isEqualTo(1);
    }

    @Test
    void terminate가_실패하면_반환_Request는_failed된다() {
        // given
        RequestId requestId = create(1);
        dispatchAndReport(requestId, 1, MachineStatus.RUNNING);
        fx.compute.failNextTerminate(new PermanentBackendException("UnauthorizedOperation"));

        // when
        RequestId returnId = engine.returnMachines(engine.getRequest(requestId).machineIds());

        // then
        Request returning = engine.getRequest(returnId);
        assertThat(returning.status()).isEqualTo(RequestStatus.FAILED);
        assertThat(returning.errorKind()).isEqualTo(ErrorKind.PERMANENT_BACKEND);
        assertThat(returning.message()).contains("UnauthorizedOperation");
    }

    @Test
    void 빈_목록은_반환할_수_없다() {
        assertThatThrownBy(() -> engine.returnMachines(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // 6. queries
    // ============================================================

    @Test
    void 활성_Request와_전체_머신을_조회한다() {
        // given
        RequestId done = create(1);
        dispatchAndReport(done, 1, MachineStatus.RUNNING);
        RequestId waiting = create(1);

        // when
        List<RequestId> active = engine.activeRequestIds();

        // then
        assertThat(active).containsExactly(waiting);
        assertThat(engine.listMachines()).hasSize(1);
        assertThat(engine.listTemplates()).extracting(t -> t.templateId().getValue())
            .contains(ONDEMAND_TEMPLATE, SPOT_TEMPLATE);
    }
}
