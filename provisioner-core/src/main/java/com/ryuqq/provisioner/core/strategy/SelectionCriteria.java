package com.ryuqq.provisioner.core.strategy;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 전략 선택 조건.
 *
 * <p><strong>필터:</strong> requiredCapabilities 부분집합 일치, requireHealthy, excluded</p>
 * <p><strong>순위:</strong> preferred 목록 순서 → minSuccessRate 충족 → maxResponseTimeMs 충족
 * → priority → 등록 순서</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record SelectionCriteria(
    Set<String> requiredCapabilities,
    boolean requireHealthy,
    Set<String> excluded,
    List<String> preferred,
    Double minSuccessRate,
    Long maxResponseTimeMs
) {

    public SelectionCriteria {
        requiredCapabilities = requiredCapabilities == null ? Set.of() : Set.copyOf(requiredCapabilities);
        excluded = excluded == null ? Set.of() : Set.copyOf(excluded);
        preferred = preferred == null ? List.of() : List.copyOf(preferred);
        if (minSuccessRate != null && (minSuccessRate < 0.0 || minSuccessRate > 1.0)) {
            throw new IllegalArgumentException(
                "minSuccessRate must be between 0.0 and 1.0 (current: " + minSuccessRate + ")");
        }
        if (maxResponseTimeMs != null && maxResponseTimeMs <= 0) {
            throw new IllegalArgumentException(
                "maxResponseTimeMs must be positive (current: " + maxResponseTimeMs + ")");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final Set<String> requiredCapabilities = new LinkedHashSet<>();
        private boolean requireHealthy = true;
        private final Set<String> excluded = new LinkedHashSet<>();
        private final List<String> preferred = new ArrayList<>();
        private Double minSuccessRate;
        private Long maxResponseTimeMs;

        private Builder() {
        }

        public Builder requireCapability(String capability) {
            this.requiredCapabilities.add(capability);
            return this;
        }

        public Builder requireHealthy(boolean requireHealthy) {
            this.requireHealthy = requireHealthy;
            return this;
        }

        public Builder exclude(String strategyName) {
            this.excluded.add(strategyName);
            return this;
        }

        public Builder excludeAll(Iterable<String> strategyNames) {
            strategyNames.forEach(this.excluded::add);
            return this;
        }

        public Builder prefer(List<String> strategyNames) {
            this.preferred.addAll(strategyNames);
            return this;
        }

        public Builder minSuccessRate(double minSuccessRate) {
            this.minSuccessRate = minSuccessRate;
            return this;
        }

        public Builder maxResponseTimeMs(long maxResponseTimeMs) {
            this.maxResponseTimeMs = maxResponseTimeMs;
            return this;
        }

        public SelectionCriteria build() {
            return new SelectionCriteria(requiredCapabilities, requireHealthy, excluded, preferred,
                minSuccessRate, maxResponseTimeMs);
        }
    }
}
