package com.ryuqq.provisioner.adapter.runner.resilience;

import com.ryuqq.provisioner.core.exception.CircuitOpenException;
import com.ryuqq.provisioner.core.exception.PermanentBackendException;
import com.ryuqq.provisioner.core.exception.ProvisioningException;
import com.ryuqq.provisioner.core.exception.TransientBackendException;
import com.ryuqq.provisioner.core.protection.BackendOperation;
import com.ryuqq.provisioner.core.protection.CircuitBreaker;
import com.ryuqq.provisioner.core.protection.CircuitBreakerState;
import com.ryuqq.provisioner.core.protection.TimeoutPolicy;
import com.ryuqq.provisioner.core.strategy.StrategyObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 전략 호출 보호 계층.
 *
 * <p>모든 {@code CloudBackend} 호출은 이 클래스를 거칩니다.</p>
 *
 * <p><strong>구성 순서:</strong></p>
 * <pre>
 * for attempt in 1..maxAttempts:
 *   breaker.tryAcquire()  → 거부 시 CircuitOpenException (백엔드 미호출, 재시도 없음)
 *   call (bounded pool, 작업별 타임아웃)
 *   성공        → breaker.recordSuccess(), 반환
 *   일시적 실패  → breaker.recordFailure(), 마지막 시도가 아니면 backoff 후 재시도
 *   영구 실패   → 즉시 PermanentBackendException
 * </pre>
 *
 * <p>재시도는 Circuit Breaker 안쪽에 있으므로 각 시도가 실패 횟수에 집계되고, 재시도 도중 breaker가
 * 열리면 남은 시도는 수행하지 않습니다. 영구 오류는 백엔드가 응답했다는 뜻이므로 breaker에는
 * 성공으로 기록합니다.</p>
 *
 * <p>호출은 크기가 고정된 스레드 풀에서 실행되어 동시에 진행 중인 백엔드 호출 수를 제한합니다.
 * 타임아웃된 호출은 인터럽트로 취소를 시도합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class ResilientExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResilientExecutor.class);

    private final RetryPolicy retryPolicy;
    private final CircuitBreakerConfig breakerConfig;
    private final TimeoutPolicy timeoutPolicy;
    private final FailureClassifier classifier;
    private final Sleeper sleeper;
    private final Clock clock;
    private final StrategyMetricsRecorder metrics;
    private final BackoffCalculator backoff;
    private final ExecutorService pool;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    private ResilientExecutor(Builder builder) {
        this.retryPolicy = builder.retryPolicy;
        this.breakerConfig = builder.breakerConfig;
        this.timeoutPolicy = builder.timeoutPolicy;
        this.classifier = builder.classifier;
        this.sleeper = builder.sleeper;
        this.clock = builder.clock;
        this.metrics = builder.metrics;
        this.backoff = new BackoffCalculator(retryPolicy);
        this.pool = Executors.newFixedThreadPool(builder.poolSize, new BackendThreadFactory());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 보호 계층을 거쳐 백엔드 호출.
     *
     * @param strategyName 호출 대상 전략 (breaker와 지표의 키)
     * @param operation 작업 종류 (타임아웃 결정)
     * @param call 실제 백엔드 호출
     * @return 호출 결과
     * @throws CircuitOpenException breaker가 호출을 거부한 경우
     * @throws TransientBackendException 일시적 오류로 모든 시도가 실패한 경우
     * @throws PermanentBackendException 영구 오류가 발생한 경우 (ProvisioningException은 원래 타입 유지)
     */
    public <T> T execute(String strategyName, BackendOperation operation, Supplier<T> call) {
        if (strategyName == null || strategyName.isBlank()) {
            throw new IllegalArgumentException("strategyName cannot be null or blank");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }
        CircuitBreaker breaker = breakerFor(strategyName);

        for (int attempt = 1; ; attempt++) {
            if (!breaker.tryAcquire()) {
                log.warn("{} {} rejected: circuit is {}", strategyName, operation, breaker.getState());
                throw new CircuitOpenException(strategyName);
            }

            long started = clock.millis();
            try {
                T result = invoke(operation, call);
                breaker.recordSuccess();
                metrics.recordCall(strategyName, true, clock.millis() - started);
                return result;
            } catch (RuntimeException e) {
                metrics.recordCall(strategyName, false, clock.millis() - started);

                if (!classifier.isTransient(e)) {
                    breaker.recordSuccess();
                    log.warn("{} {} failed permanently: {}", strategyName, operation, e.getMessage());
                    throw asPermanent(strategyName, operation, e);
                }

                breaker.recordFailure(e);
                if (attempt >= retryPolicy.maxAttempts()) {
                    log.warn("{} {} failed after {} attempts: {}", strategyName, operation, attempt, e.getMessage());
                    throw new TransientBackendException(String.format(
                        "%s %s failed after %d attempts: %s", strategyName, operation, attempt, e.getMessage()), e);
                }

                long delay = backoff.calculate(attempt);
                log.warn("{} {} attempt {}/{} failed, retrying in {}ms: {}",
                    strategyName, operation, attempt, retryPolicy.maxAttempts(), delay, e.getMessage());
                pause(delay);
            }
        }
    }

    private <T> T invoke(BackendOperation operation, Supplier<T> call) {
        long limitMs = timeoutPolicy.getPerAttemptTimeoutMs(operation);
        long startedNanos = System.nanoTime();
        Callable<T> task = call::get;
        Future<T> future = pool.submit(task);
        try {
            return limitMs > 0 ? future.get(limitMs, TimeUnit.MILLISECONDS) : future.get();
        } catch (TimeoutException e) {
            future.cancel(true);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
            timeoutPolicy.recordTimeout(operation, elapsedMs);
            throw new TransientBackendException(operation + " call timed out after " + limitMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new TransientBackendException(operation + " call failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientBackendException(operation + " call interrupted", e);
        }
    }

    private static ProvisioningException asPermanent(String strategyName, BackendOperation operation,
                                                     RuntimeException e) {
        if (e instanceof ProvisioningException) {
            return (ProvisioningException) e;
        }
        return new PermanentBackendException(strategyName + " " + operation + " failed: " + e.getMessage(), e);
    }

    private void pause(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientBackendException("Retry backoff interrupted", e);
        }
    }

    /**
     * 전략별 breaker (처음 요청 시 생성, 이후 모든 호출자가 공유).
     */
    public CircuitBreaker breakerFor(String strategyName) {
        return breakers.computeIfAbsent(strategyName,
            name -> new DefaultCircuitBreaker(name, breakerConfig, clock));
    }

    /**
     * 전략 선택용 관측값 (호출 지표 + breaker 상태).
     */
    public Map<String, StrategyObservation> observations() {
        Map<String, CircuitBreakerState> states = new LinkedHashMap<>();
        breakers.forEach((name, breaker) -> states.put(name, breaker.getState()));
        return metrics.snapshot(states);
    }

    public StrategyMetricsRecorder metrics() {
        return metrics;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    /**
     * 호출 풀 종료 (진행 중인 호출은 최대 60초 대기).
     */
    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(60, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class BackendThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "provisioner-backend-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    public static final class Builder {

        private RetryPolicy retryPolicy = new RetryPolicy();
        private CircuitBreakerConfig breakerConfig = new CircuitBreakerConfig();
        private TimeoutPolicy timeoutPolicy = new OperationTimeoutPolicy(30000, 10000, 30000);
        private FailureClassifier classifier = new FailureClassifier();
        private Sleeper sleeper = Sleeper.SYSTEM;
        private Clock clock = Clock.systemUTC();
        private StrategyMetricsRecorder metrics = new StrategyMetricsRecorder();
        private int poolSize = 8;

        private Builder() {
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder circuitBreakerConfig(CircuitBreakerConfig breakerConfig) {
            this.breakerConfig = breakerConfig;
            return this;
        }

        public Builder timeoutPolicy(TimeoutPolicy timeoutPolicy) {
            this.timeoutPolicy = timeoutPolicy;
            return this;
        }

        public Builder failureClassifier(FailureClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metrics(StrategyMetricsRecorder metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder poolSize(int poolSize) {
            this.poolSize = poolSize;
            return this;
        }

        public ResilientExecutor build() {
            if (retryPolicy == null) {
                throw new IllegalArgumentException("retryPolicy cannot be null");
            }
            if (breakerConfig == null) {
                throw new IllegalArgumentException("circuitBreakerConfig cannot be null");
            }
            if (timeoutPolicy == null) {
                throw new IllegalArgumentException("timeoutPolicy cannot be null");
            }
            if (classifier == null) {
                throw new IllegalArgumentException("failureClassifier cannot be null");
            }
            if (sleeper == null) {
                throw new IllegalArgumentException("sleeper cannot be null");
            }
            if (clock == null) {
                throw new IllegalArgumentException("clock cannot be null");
            }
            if (metrics == null) {
                throw new IllegalArgumentException("metrics cannot be null");
            }
            if (poolSize <= 0) {
                throw new IllegalArgumentException("poolSize must be positive (current: " + poolSize + ")");
            }
            return new ResilientExecutor(this);
        }
    }
}
