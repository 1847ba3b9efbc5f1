package com.ryuqq.provisioner.adapter.runner.resilience;

import com.ryuqq.provisioner.core.exception.ProvisioningException;
import com.ryuqq.provisioner.core.protection.BackendOperation;
import com.ryuqq.provisioner.core.spi.HealthState;
import com.ryuqq.provisioner.core.strategy.StrategyRegistration;
import com.ryuqq.provisioner.core.strategy.StrategyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 등록된 모든 전략의 healthCheck를 호출하여 지표에 반영.
 *
 * <p>health check 호출이 실패하면 해당 전략은 UNHEALTHY로 기록됩니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class StrategyHealthProbe {

    private static final Logger log = LoggerFactory.getLogger(StrategyHealthProbe.class);

    private final StrategyRegistry registry;
    private final ResilientExecutor executor;

    public StrategyHealthProbe(StrategyRegistry registry, ResilientExecutor executor) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.registry = registry;
        this.executor = executor;
    }

    /**
     * 모든 전략 점검.
     *
     * @return 전략 이름 → 점검 결과
     */
    public Map<String, HealthState> probe() {
        Map<String, HealthState> result = new LinkedHashMap<>();
        for (StrategyRegistration registration : registry.all()) {
            HealthState state;
            try {
                state = executor.execute(registration.name(), BackendOperation.HEALTH_CHECK,
                    () -> registration.backend().healthCheck());
            } catch (ProvisioningException e) {
                log.warn("Health check of strategy {} failed: {}", registration.name(), e.getMessage());
                state = HealthState.UNHEALTHY;
            }
            if (state == null) {
                state = HealthState.UNHEALTHY;
            }
            executor.metrics().recordHealth(registration.name(), state);
            result.put(registration.name(), state);
        }
        return result;
    }
}
