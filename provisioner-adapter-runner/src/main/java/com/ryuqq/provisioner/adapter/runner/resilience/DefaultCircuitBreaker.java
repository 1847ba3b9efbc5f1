package com.ryuqq.provisioner.adapter.runner.resilience;

import com.ryuqq.provisioner.core.protection.CircuitBreaker;
import com.ryuqq.provisioner.core.protection.CircuitBreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 연속 실패 횟수 기반 Circuit Breaker.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED    --(연속 실패 failureThreshold회)--&gt; OPEN
 * OPEN      --(recoveryTimeout 경과 후 tryAcquire)--&gt; HALF_OPEN
 * HALF_OPEN --(실패 1회)--&gt; OPEN
 * HALF_OPEN --(시험 호출 halfOpenMaxCalls회 모두 성공)--&gt; CLOSED
 * </pre>
 *
 * <p>전략 하나의 모든 호출자가 하나의 인스턴스를 공유합니다. 상태는 불변 스냅샷 하나로 표현되고
 * 모든 전이는 {@link AtomicReference#compareAndSet}로 한 번에 일어나므로, 두 호출자가 같은 전이를
 * 중복 수행하거나 서로 어긋난 상태를 만들지 않습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class DefaultCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(DefaultCircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final AtomicReference<Snapshot> state = new AtomicReference<>(Snapshot.closed());

    public DefaultCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire() {
        while (true) {
            Snapshot current = state.get();
            switch (current.state) {
                case CLOSED:
                    return true;
                case OPEN: {
                    if (!recoveryElapsed(current)) {
                        return false;
                    }
                    Snapshot trial = new Snapshot(CircuitBreakerState.HALF_OPEN, 0, current.openedAtMs, 1, 0);
                    if (state.compareAndSet(current, trial)) {
                        log.info("Circuit breaker {} is HALF_OPEN, allowing trial calls", name);
                        return true;
                    }
                    break;
                }
                case HALF_OPEN: {
                    if (current.trialsIssued >= config.halfOpenMaxCalls()) {
                        return false;
                    }
                    Snapshot next = new Snapshot(CircuitBreakerState.HALF_OPEN, 0, current.openedAtMs,
                        current.trialsIssued + 1, current.trialSuccesses);
                    if (state.compareAndSet(current, next)) {
                        return true;
                    }
                    break;
                }
                default:
                    throw new IllegalStateException("Unknown circuit breaker state: " + current.state);
            }
        }
    }

    @Override
    public void recordSuccess() {
        while (true) {
            Snapshot current = state.get();
            Snapshot next;
            if (current.state == CircuitBreakerState.CLOSED) {
                if (current.consecutiveFailures == 0) {
                    return;
                }
                next = Snapshot.closed();
            } else if (current.state == CircuitBreakerState.HALF_OPEN) {
                int successes = current.trialSuccesses + 1;
                next = successes >= config.halfOpenMaxCalls()
                    ? Snapshot.closed()
                    : new Snapshot(CircuitBreakerState.HALF_OPEN, 0, current.openedAtMs, current.trialsIssued, successes);
            } else {
                // OPEN 중 도착한 늦은 응답은 상태를 바꾸지 않음
                return;
            }
            if (state.compareAndSet(current, next)) {
                if (current.state == CircuitBreakerState.HALF_OPEN && next.state == CircuitBreakerState.CLOSED) {
                    log.info("Circuit breaker {} is CLOSED after successful trial calls", name);
                }
                return;
            }
        }
    }

    @Override
    public void recordFailure(Throwable throwable) {
        while (true) {
            Snapshot current = state.get();
            Snapshot next;
            if (current.state == CircuitBreakerState.CLOSED) {
                int failures = current.consecutiveFailures + 1;
                next = failures >= config.failureThreshold()
                    ? Snapshot.open(clock.millis())
                    : new Snapshot(CircuitBreakerState.CLOSED, failures, 0, 0, 0);
            } else if (current.state == CircuitBreakerState.HALF_OPEN) {
                next = Snapshot.open(clock.millis());
            } else {
                return;
            }
            if (state.compareAndSet(current, next)) {
                if (next.state == CircuitBreakerState.OPEN) {
                    log.warn("Circuit breaker {} is OPEN after {} (recovery in {}ms)", name,
                        current.state == CircuitBreakerState.HALF_OPEN
                            ? "a failed trial call"
                            : config.failureThreshold() + " consecutive failures",
                        config.recoveryTimeoutMs(), throwable);
                }
                return;
            }
        }
    }

    /**
     * 현재 상태 조회.
     *
     * <p>recoveryTimeout이 지난 OPEN은 다음 {@link #tryAcquire()}에서 시험 호출을 허용하므로
     * HALF_OPEN으로 보고합니다. 저장된 상태는 {@link #tryAcquire()}만 바꿉니다.</p>
     */
    @Override
    public CircuitBreakerState getState() {
        Snapshot current = state.get();
        if (current.state == CircuitBreakerState.OPEN && recoveryElapsed(current)) {
            return CircuitBreakerState.HALF_OPEN;
        }
        return current.state;
    }

    @Override
    public void reset() {
        Snapshot previous = state.getAndSet(Snapshot.closed());
        if (previous.state != CircuitBreakerState.CLOSED) {
            log.info("Circuit breaker {} reset from {}", name, previous.state);
        }
    }

    private boolean recoveryElapsed(Snapshot snapshot) {
        return clock.millis() - snapshot.openedAtMs >= config.recoveryTimeoutMs();
    }

    public String getName() {
        return name;
    }

    /**
     * CLOSED 상태에서 누적된 연속 실패 수.
     */
    public int getConsecutiveFailures() {
        return state.get().consecutiveFailures;
    }

    private static final class Snapshot {

        private final CircuitBreakerState state;
        private final int consecutiveFailures;
        private final long openedAtMs;
        private final int trialsIssued;
        private final int trialSuccesses;

        private Snapshot(CircuitBreakerState state, int consecutiveFailures, long openedAtMs,
                         int trialsIssued, int trialSuccesses) {
            this.state = state;
            this.consecutiveFailures = consecutiveFailures;
            this.openedAtMs = openedAtMs;
            this.trialsIssued = trialsIssued;
            this.trialSuccesses = trialSuccesses;
        }

        static Snapshot closed() {
            return new Snapshot(CircuitBreakerState.CLOSED, 0, 0, 0, 0);
        }

        static Snapshot open(long openedAtMs) {
            return new Snapshot(CircuitBreakerState.OPEN, 0, openedAtMs, 0, 0);
        }
    }
}
