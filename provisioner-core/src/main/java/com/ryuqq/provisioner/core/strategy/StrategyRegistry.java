package com.ryuqq.provisioner.core.strategy;

import com.ryuqq.provisioner.core.exception.NoSuitableStrategyException;
import com.ryuqq.provisioner.core.spi.HealthState;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 백엔드 전략 등록부 및 선택 알고리즘.
 *
 * <p>선택은 호출 시 전달된 건강/지표 스냅샷만으로 결정되는 순수 함수입니다.
 * 같은 입력이면 항상 같은 전략을 반환하며, 동점은 등록 순서로 결정합니다.</p>
 *
 * <p><strong>선택 알고리즘:</strong></p>
 * <ol>
 *   <li>필터: capability 부분집합 일치 → (requireHealthy) UNHEALTHY 제외 → 제외 목록</li>
 *   <li>순위: 선호 목록 순서 → 성공률 ≥ minSuccessRate → 평균 지연 ≤ maxResponseTimeMs
 *       → priority 내림차순 → 등록 순서</li>
 * </ol>
 *
 * <p><strong>Thread-Safety:</strong> 등록과 조회를 동시에 호출해도 안전합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class StrategyRegistry {

    private final List<StrategyRegistration> registrations = new CopyOnWriteArrayList<>();

    /**
     * 전략 등록.
     *
     * @throws IllegalArgumentException 같은 이름이 이미 등록된 경우
     */
    public synchronized void register(StrategyRegistration registration) {
        if (registration == null) {
            throw new IllegalArgumentException("registration cannot be null");
        }
        if (find(registration.name()).isPresent()) {
            throw new IllegalArgumentException("Strategy already registered: " + registration.name());
        }
        registrations.add(registration);
    }

    public Optional<StrategyRegistration> find(String name) {
        return registrations.stream().filter(r -> r.name().equals(name)).findFirst();
    }

    /**
     * 이름으로 조회.
     *
     * @throws NoSuitableStrategyException 등록되지 않은 이름인 경우
     */
    public StrategyRegistration get(String name) {
        return find(name).orElseThrow(() ->
            new NoSuitableStrategyException("registered", "Strategy not registered: " + name));
    }

    /**
     * 등록 순서대로 전체 전략.
     */
    public List<StrategyRegistration> all() {
        return List.copyOf(registrations);
    }

    /**
     * 조건에 맞는 최상위 전략 선택.
     *
     * @param criteria 선택 조건
     * @param observations 전략 이름별 건강/지표 스냅샷 (없으면 {@link StrategyObservation#UNOBSERVED})
     * @return 선택된 전략
     * @throws NoSuitableStrategyException 후보가 남지 않은 경우 (마지막으로 후보를 탈락시킨 조건 포함)
     */
    public StrategyRegistration select(SelectionCriteria criteria, Map<String, StrategyObservation> observations) {
        return rank(criteria, observations).get(0);
    }

    /**
     * 조건에 맞는 전략 전체를 순위대로 반환.
     *
     * @throws NoSuitableStrategyException 후보가 남지 않은 경우
     */
    public List<StrategyRegistration> rank(SelectionCriteria criteria, Map<String, StrategyObservation> observations) {
        if (criteria == null) {
            throw new IllegalArgumentException("criteria cannot be null");
        }
        List<StrategyRegistration> declared = all();
        if (declared.isEmpty()) {
            throw new NoSuitableStrategyException("registered", "No strategies are registered");
        }

        List<StrategyRegistration> candidates = declared.stream()
            .filter(r -> r.supports(criteria.requiredCapabilities()))
            .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            throw new NoSuitableStrategyException("capabilities",
                "No strategy provides capabilities " + criteria.requiredCapabilities());
        }

        if (criteria.requireHealthy()) {
            candidates = candidates.stream()
                .filter(r -> observationOf(r, observations).health() != HealthState.UNHEALTHY)
                .collect(Collectors.toList());
            if (candidates.isEmpty()) {
                throw new NoSuitableStrategyException("healthy",
                    "No healthy strategy provides capabilities " + criteria.requiredCapabilities());
            }
        }

        candidates = candidates.stream()
            .filter(r -> !criteria.excluded().contains(r.name()))
            .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            throw new NoSuitableStrategyException("exclusion",
                "All matching strategies are excluded " + criteria.excluded());
        }

        Comparator<StrategyRegistration> order = Comparator
            .comparingInt((StrategyRegistration r) -> preferenceIndex(criteria, r))
            .thenComparingInt(r -> meetsSuccessRate(criteria, observationOf(r, observations)) ? 0 : 1)
            .thenComparingInt(r -> meetsLatency(criteria, observationOf(r, observations)) ? 0 : 1)
            .thenComparing(Comparator.comparingInt(StrategyRegistration::priority).reversed())
            .thenComparingInt(declared::indexOf);

        List<StrategyRegistration> ranked = new ArrayList<>(candidates);
        ranked.sort(order);
        return ranked;
    }

    private static StrategyObservation observationOf(StrategyRegistration r, Map<String, StrategyObservation> observations) {
        if (observations == null) {
            return StrategyObservation.UNOBSERVED;
        }
        return observations.getOrDefault(r.name(), StrategyObservation.UNOBSERVED);
    }

    private static int preferenceIndex(SelectionCriteria criteria, StrategyRegistration r) {
        int index = criteria.preferred().indexOf(r.name());
        return index < 0 ? Integer.MAX_VALUE : index;
    }

    private static boolean meetsSuccessRate(SelectionCriteria criteria, StrategyObservation observation) {
        return criteria.minSuccessRate() == null || observation.successRate() >= criteria.minSuccessRate();
    }

    private static boolean meetsLatency(SelectionCriteria criteria, StrategyObservation observation) {
        return criteria.maxResponseTimeMs() == null || observation.averageLatencyMs() <= criteria.maxResponseTimeMs();
    }
}
