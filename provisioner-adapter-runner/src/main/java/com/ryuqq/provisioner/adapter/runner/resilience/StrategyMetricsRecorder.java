package com.ryuqq.provisioner.adapter.runner.resilience;

import com.ryuqq.provisioner.core.protection.CircuitBreakerState;
import com.ryuqq.provisioner.core.spi.HealthState;
import com.ryuqq.provisioner.core.strategy.StrategyObservation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 전략별 호출 결과와 지연 시간을 최근 N건 단위로 기록.
 *
 * <p>{@link #snapshot(Map)}은 전략 선택에 넘길 관측값을 만듭니다. Circuit Breaker가
 * OPEN인 전략은 마지막 health check 결과와 상관없이 UNHEALTHY, HALF_OPEN이면 최소 DEGRADED로
 * 보고됩니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class StrategyMetricsRecorder {

    private final int windowSize;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final Map<String, HealthState> health = new ConcurrentHashMap<>();

    public StrategyMetricsRecorder() {
        this(50);
    }

    public StrategyMetricsRecorder(int windowSize) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive (current: " + windowSize + ")");
        }
        this.windowSize = windowSize;
    }

    public void recordCall(String strategyName, boolean success, long latencyMs) {
        windows.computeIfAbsent(strategyName, k -> new Window(windowSize)).add(success, latencyMs);
    }

    public void recordHealth(String strategyName, HealthState state) {
        health.put(strategyName, state);
    }

    /**
     * 선택 알고리즘용 관측값.
     *
     * @param breakerStates 전략 이름 → Circuit Breaker 상태
     * @return 전략 이름 → 관측값 (호출, health, breaker 어느 기록도 없는 전략은 포함하지 않음)
     */
    public Map<String, StrategyObservation> snapshot(Map<String, CircuitBreakerState> breakerStates) {
        Map<String, StrategyObservation> result = new LinkedHashMap<>();
        Set<String> names = new LinkedHashSet<>(breakerStates.keySet());
        names.addAll(windows.keySet());
        names.addAll(health.keySet());
        for (String name : names) {
            Window window = windows.get(name);
            double successRate = window == null ? 1.0 : window.successRate();
            double latency = window == null ? 0.0 : window.averageLatencyMs();
            long samples = window == null ? 0 : window.size();
            HealthState state = effectiveHealth(health.getOrDefault(name, HealthState.HEALTHY),
                breakerStates.get(name));
            result.put(name, new StrategyObservation(state, successRate, latency, samples));
        }
        return result;
    }

    private static HealthState effectiveHealth(HealthState reported, CircuitBreakerState breaker) {
        if (breaker == CircuitBreakerState.OPEN) {
            return HealthState.UNHEALTHY;
        }
        if (breaker == CircuitBreakerState.HALF_OPEN && reported == HealthState.HEALTHY) {
            return HealthState.DEGRADED;
        }
        return reported;
    }

    private static final class Window {

        private final int capacity;
        private final Deque<long[]> samples = new ArrayDeque<>();

        Window(int capacity) {
            this.capacity = capacity;
        }

        synchronized void add(boolean success, long latencyMs) {
            if (samples.size() == capacity) {
                samples.removeFirst();
            }
            samples.addLast(new long[] {success ? 1 : 0, Math.max(0, latencyMs)});
        }

        synchronized double successRate() {
            if (samples.isEmpty()) {
                return 1.0;
            }
            long ok = samples.stream().filter(s -> s[0] == 1).count();
            return (double) ok / samples.size();
        }

        synchronized double averageLatencyMs() {
            return samples.stream().mapToLong(s -> s[1]).average().orElse(0.0);
        }

        synchronized int size() {
            return samples.size();
        }
    }
}
