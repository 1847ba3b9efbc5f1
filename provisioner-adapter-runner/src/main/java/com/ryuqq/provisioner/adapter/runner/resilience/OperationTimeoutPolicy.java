package com.ryuqq.provisioner.adapter.runner.resilience;

import com.ryuqq.provisioner.core.protection.BackendOperation;
import com.ryuqq.provisioner.core.protection.TimeoutPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 백엔드 작업 종류별 고정 타임아웃.
 *
 * <p>HEALTH_CHECK는 POLL과 같은 제한을 사용합니다. 0은 제한 없음입니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class OperationTimeoutPolicy implements TimeoutPolicy {

    private static final Logger log = LoggerFactory.getLogger(OperationTimeoutPolicy.class);

    private final Map<BackendOperation, Long> limits = new EnumMap<>(BackendOperation.class);
    private final Map<BackendOperation, AtomicLong> timeouts = new EnumMap<>(BackendOperation.class);

    public OperationTimeoutPolicy(long provisionTimeoutMs, long pollTimeoutMs, long terminateTimeoutMs) {
        limits.put(BackendOperation.PROVISION, requireNonNegative("provisionTimeoutMs", provisionTimeoutMs));
        limits.put(BackendOperation.POLL, requireNonNegative("pollTimeoutMs", pollTimeoutMs));
        limits.put(BackendOperation.TERMINATE, requireNonNegative("terminateTimeoutMs", terminateTimeoutMs));
        limits.put(BackendOperation.HEALTH_CHECK, pollTimeoutMs);
        for (BackendOperation operation : BackendOperation.values()) {
            timeouts.put(operation, new AtomicLong());
        }
    }

    private static long requireNonNegative(String name, long value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " cannot be negative (current: " + value + ")");
        }
        return value;
    }

    @Override
    public long getPerAttemptTimeoutMs(BackendOperation operation) {
        return limits.get(operation);
    }

    @Override
    public void recordTimeout(BackendOperation operation, long elapsedMs) {
        long total = timeouts.get(operation).incrementAndGet();
        log.warn("{} call timed out after {}ms (limit: {}ms, total timeouts: {})",
            operation, elapsedMs, limits.get(operation), total);
    }

    /**
     * 지금까지 기록된 타임아웃 횟수.
     */
    public long timeoutCount(BackendOperation operation) {
        return timeouts.get(operation).get();
    }
}
