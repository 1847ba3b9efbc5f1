package com.ryuqq.provisioner.core.strategy;

import com.ryuqq.provisioner.core.spi.CloudBackend;

import java.util.Set;

/**
 * 이름으로 등록된 백엔드 전략.
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param name 전략 이름 (고유)
 * @param backend 백엔드 구현
 * @param capabilities 선언된 capability 집합 (예: compute, fleet, scaling, spot)
 * @param priority 정적 우선순위 (클수록 우선)
 */
public record StrategyRegistration(
    String name,
    CloudBackend backend,
    Set<String> capabilities,
    int priority
) {

    public StrategyRegistration {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    public boolean supports(Set<String> required) {
        return capabilities.containsAll(required);
    }
}
