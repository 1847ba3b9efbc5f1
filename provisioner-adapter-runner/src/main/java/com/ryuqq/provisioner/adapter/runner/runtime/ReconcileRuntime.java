package com.ryuqq.provisioner.adapter.runner.runtime;

import com.ryuqq.provisioner.adapter.runner.resilience.StrategyHealthProbe;
import com.ryuqq.provisioner.application.engine.ProvisioningEngine;
import com.ryuqq.provisioner.application.runtime.Runtime;
import com.ryuqq.provisioner.core.model.Request;
import com.ryuqq.provisioner.core.model.RequestId;
import com.ryuqq.provisioner.core.model.RequestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;

/**
 * pending Request를 dispatch하고 running Request를 polling하는 {@link Runtime}.
 *
 * <p>running Request마다 다음 poll 시각을 따로 가집니다. reconcile 후에는
 * {@code now + pollInterval * (1 +/- jitterFactor)}로 다시 예약되므로, 함께 생성된 Request들이
 * 백엔드 API를 한꺼번에 두드리지 않습니다. 한 주기는 시작한 작업이 모두 끝날 때까지 블로킹됩니다.</p>
 *
 * <p>{@link StrategyHealthProbe}가 주어지면 전략 health는 poll 간격당 최대 한 번,
 * 주기 시작 시점에 갱신됩니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ReconcileRuntime implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(ReconcileRuntime.class);

    private final ProvisioningEngine engine;
    private final ReconcilerConfig config;
    private final Clock clock;
    private final StrategyHealthProbe healthProbe;
    private final DoubleSupplier random;
    private final ExecutorService workerExecutor;
    private final Map<RequestId, Long> nextPollAt = new ConcurrentHashMap<>();
    private volatile long lastProbeAt = Long.MIN_VALUE;

    public ReconcileRuntime(ProvisioningEngine engine, ReconcilerConfig config, Clock clock) {
        this(engine, config, clock, null, () -> ThreadLocalRandom.current().nextDouble());
    }

    public ReconcileRuntime(ProvisioningEngine engine, ReconcilerConfig config, Clock clock,
                            StrategyHealthProbe healthProbe) {
        this(engine, config, clock, healthProbe, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param engine 프로비저닝 엔진
     * @param config 런타임 설정
     * @param clock poll 예약용 시계
     * @param healthProbe 전략 health probe (nullable)
     * @param random jitter에 쓰는 [0, 1) 난수 공급자
     * @throws IllegalArgumentException 필수 의존성이 null인 경우
     */
    public ReconcileRuntime(ProvisioningEngine engine, ReconcilerConfig config, Clock clock,
                            StrategyHealthProbe healthProbe, DoubleSupplier random) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.engine = engine;
        this.config = config;
        this.clock = clock;
        this.healthProbe = healthProbe;
        this.random = random;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
    }

    @Override
    public int pump() {
        long now = clock.millis();
        refreshHealth(now);

        List<RequestId> active = engine.activeRequestIds();
        List<Callable<Void>> tasks = new ArrayList<>();
        for (RequestId requestId : active) {
            if (tasks.size() >= config.batchSize()) {
                break;
            }
            Callable<Void> task = taskFor(requestId, now);
            if (task != null) {
                tasks.add(task);
            }
        }

        if (!tasks.isEmpty()) {
            try {
                workerExecutor.invokeAll(tasks);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Reconcile cycle interrupted with {} tasks submitted", tasks.size());
            }
        }

        Set<RequestId> stillActive = new HashSet<>(active);
        nextPollAt.keySet().removeIf(id -> !stillActive.contains(id));
        if (!tasks.isEmpty()) {
            log.debug("Reconcile cycle processed {} of {} active requests", tasks.size(), active.size());
        }
        return tasks.size();
    }

    private Callable<Void> taskFor(RequestId requestId, long now) {
        Request request;
        try {
            request = engine.getRequest(requestId);
        } catch (RuntimeException e) {
            log.error("Failed to load request {} in reconcile cycle", requestId, e);
            return null;
        }
        if (request.isTerminal()) {
            return null;
        }
        if (request.status() == RequestStatus.PENDING) {
            if (request.cancellationRequested()) {
                return () -> run(requestId, "reconcile", () -> engine.reconcile(requestId));
            }
            if (request.dispatchClaimedAt() == null) {
                return () -> {
                    run(requestId, "dispatch", () -> engine.dispatch(requestId));
                    reschedule(requestId);
                    return null;
                };
            }
            return null;
        }
        Long due = nextPollAt.get(requestId);
        if (due != null && due > now && !request.cancellationRequested()) {
            return null;
        }
        return () -> {
            run(requestId, "reconcile", () -> engine.reconcile(requestId));
            reschedule(requestId);
            return null;
        };
    }

    private Void run(RequestId requestId, String action, Runnable work) {
        try {
            work.run();
        } catch (Exception e) {
            log.error("Failed to {} request {} in reconcile cycle", action, requestId, e);
        }
        return null;
    }

    private void reschedule(RequestId requestId) {
        nextPollAt.put(requestId, clock.millis() + nextDelayMs());
    }

    /**
     * jitter가 적용된 poll 지연 시간.
     */
    long nextDelayMs() {
        double spread = config.jitterFactor() * (2 * random.getAsDouble() - 1);
        return Math.max(0, Math.round(config.pollIntervalMs() * (1 + spread)));
    }

    private void refreshHealth(long now) {
        if (healthProbe == null) {
            return;
        }
        if (lastProbeAt != Long.MIN_VALUE && now - lastProbeAt < config.pollIntervalMs()) {
            return;
        }
        lastProbeAt = now;
        try {
            healthProbe.probe();
        } catch (RuntimeException e) {
            log.error("Strategy health probe failed", e);
        }
    }

    /**
     * 예약된 다음 poll 시각 (epoch 밀리초, 없으면 null).
     */
    public Long nextPollAt(RequestId requestId) {
        return nextPollAt.get(requestId);
    }

    /**
     * 워커 풀 종료 (실행 중인 작업을 최대 60초 대기).
     *
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            workerExecutor.shutdownNow();
        }
    }
}
