package com.ryuqq.provisioner.adapter.runner.backend;

import com.ryuqq.provisioner.core.exception.ProvisioningException;
import com.ryuqq.provisioner.core.spi.BackendHandle;
import com.ryuqq.provisioner.core.spi.CloudBackend;
import com.ryuqq.provisioner.core.spi.HealthState;
import com.ryuqq.provisioner.core.spi.MachineStatusReport;
import com.ryuqq.provisioner.core.spi.ProvisioningHandle;
import com.ryuqq.provisioner.core.spi.TerminationHandle;
import com.ryuqq.provisioner.core.template.ResolvedSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 스팟 백엔드와 온디맨드 백엔드를 하나의 {@link CloudBackend}로 묶는 혼합 가격 백엔드.
 *
 * <p><strong>provision:</strong></p>
 * <pre>
 * onDemandCount = floor(count * percentOnDemand / 100), spotCount = 나머지
 * 1. 스팟 백엔드에 spotCount 요청
 *    - 실패하면 전체를 온디맨드로 요청
 *    - 스팟 핸들의 requestedCount가 spotCount보다 작으면 부족분을 온디맨드에 추가
 * 2. 온디맨드 백엔드에 onDemandCount(+부족분) 요청
 *    - 스팟이 일부라도 성공한 상태에서 실패하면 부분 결과 유지 (WARN)
 * </pre>
 *
 * <p>결과 핸들은 각 leg의 핸들을 metadata({@code spot.handleId}, {@code spot.count},
 * {@code ondemand.handleId}, {@code ondemand.count})에 기록하며, poll은 leg별로 수행한 뒤 합칩니다.
 * 회수된 스팟 인스턴스를 자동으로 대체하지는 않습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class HeterogeneousCloudBackend implements CloudBackend {

    private static final Logger log = LoggerFactory.getLogger(HeterogeneousCloudBackend.class);

    static final String SPOT = "spot";
    static final String ON_DEMAND = "ondemand";

    private final CloudBackend spot;
    private final CloudBackend onDemand;
    private final int percentOnDemand;
    private final Map<String, String> legByResource = new ConcurrentHashMap<>();

    public HeterogeneousCloudBackend(CloudBackend spot, CloudBackend onDemand) {
        this(spot, onDemand, 0);
    }

    /**
     * @param spot 스팟 인스턴스 백엔드
     * @param onDemand 온디맨드 인스턴스 백엔드
     * @param percentOnDemand 처음부터 온디맨드로 요청할 비율 (0~100)
     */
    public HeterogeneousCloudBackend(CloudBackend spot, CloudBackend onDemand, int percentOnDemand) {
        if (spot == null) {
            throw new IllegalArgumentException("spot cannot be null");
        }
        if (onDemand == null) {
            throw new IllegalArgumentException("onDemand cannot be null");
        }
        if (percentOnDemand < 0 || percentOnDemand > 100) {
            throw new IllegalArgumentException(
                "percentOnDemand must be between 0 and 100 (current: " + percentOnDemand + ")");
        }
        this.spot = spot;
        this.onDemand = onDemand;
        this.percentOnDemand = percentOnDemand;
    }

    @Override
    public ProvisioningHandle provision(ResolvedSpec spec, int count) {
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive (current: " + count + ")");
        }
        int onDemandCount = count * percentOnDemand / 100;
        int spotCount = count - onDemandCount;

        ProvisioningHandle spotHandle = null;
        if (spotCount > 0) {
            try {
                spotHandle = spot.provision(spec, spotCount);
                if (spotHandle.requestedCount() < spotCount) {
                    onDemandCount += spotCount - spotHandle.requestedCount();
                }
            } catch (ProvisioningException e) {
                log.warn("Spot provision of {} failed, falling back to on-demand: {}", spotCount, e.getMessage());
                onDemandCount = count;
            }
        }

        ProvisioningHandle onDemandHandle = null;
        if (onDemandCount > 0) {
            try {
                onDemandHandle = onDemand.provision(spec, onDemandCount);
            } catch (ProvisioningException e) {
                if (spotHandle == null) {
                    throw e;
                }
                log.warn("On-demand provision of {} failed, keeping {} spot machines: {}",
                    onDemandCount, spotHandle.requestedCount(), e.getMessage());
            }
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        List<String> resourceIds = new ArrayList<>();
        int total = 0;
        total += describeLeg(SPOT, spotHandle, metadata, resourceIds);
        total += describeLeg(ON_DEMAND, onDemandHandle, metadata, resourceIds);
        String handleId = "hetero-" + (spotHandle != null ? spotHandle.handleId() : onDemandHandle.handleId());
        return new ProvisioningHandle(handleId, spec.backendType(), total, resourceIds, metadata);
    }

    private int describeLeg(String leg, ProvisioningHandle handle, Map<String, String> metadata,
                            List<String> resourceIds) {
        if (handle == null) {
            return 0;
        }
        metadata.put(leg + ".handleId", handle.handleId());
        metadata.put(leg + ".count", String.valueOf(handle.requestedCount()));
        for (String resourceId : handle.resourceIds()) {
            legByResource.put(resourceId, leg);
            resourceIds.add(resourceId);
        }
        return handle.requestedCount();
    }

    @Override
    public List<MachineStatusReport> pollStatus(BackendHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        List<MachineStatusReport> reports = new ArrayList<>();
        if (handle instanceof ProvisioningHandle) {
            ProvisioningHandle composite = (ProvisioningHandle) handle;
            for (String leg : List.of(SPOT, ON_DEMAND)) {
                String legHandleId = composite.metadata().get(leg + ".handleId");
                if (legHandleId == null) {
                    continue;
                }
                int legCount = Integer.parseInt(composite.metadata().get(leg + ".count"));
                ProvisioningHandle legHandle = new ProvisioningHandle(legHandleId, composite.backendType(),
                    legCount, List.of(), Map.of());
                for (MachineStatusReport report : backendFor(leg).pollStatus(legHandle)) {
                    legByResource.put(report.resourceId(), leg);
                    reports.add(report);
                }
            }
        } else if (handle instanceof TerminationHandle) {
            TerminationHandle composite = (TerminationHandle) handle;
            for (String leg : List.of(SPOT, ON_DEMAND)) {
                String legHandleId = composite.metadata().get(leg + ".handleId");
                if (legHandleId == null) {
                    continue;
                }
                List<String> legResources = Arrays.asList(composite.metadata().get(leg + ".resourceIds").split(","));
                reports.addAll(backendFor(leg).pollStatus(
                    new TerminationHandle(legHandleId, legResources, Map.of())));
            }
        }
        return reports;
    }

    /**
     * 리소스를 만든 leg로 나누어 종료. 알 수 없는 리소스는 온디맨드 백엔드로 보냅니다.
     */
    @Override
    public TerminationHandle terminate(List<String> resourceIds) {
        if (resourceIds == null || resourceIds.isEmpty()) {
            throw new IllegalArgumentException("resourceIds cannot be null or empty");
        }
        Map<String, List<String>> byLeg = new LinkedHashMap<>();
        for (String resourceId : resourceIds) {
            byLeg.computeIfAbsent(legByResource.getOrDefault(resourceId, ON_DEMAND), k -> new ArrayList<>())
                .add(resourceId);
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        String firstHandleId = null;
        for (Map.Entry<String, List<String>> entry : byLeg.entrySet()) {
            String leg = entry.getKey();
            TerminationHandle legHandle = backendFor(leg).terminate(entry.getValue());
            metadata.put(leg + ".handleId", legHandle.handleId());
            metadata.put(leg + ".resourceIds", String.join(",", legHandle.resourceIds()));
            if (firstHandleId == null) {
                firstHandleId = legHandle.handleId();
            }
        }
        return new TerminationHandle("hetero-" + firstHandleId, resourceIds, metadata);
    }

    /**
     * 두 leg가 모두 UNHEALTHY이면 UNHEALTHY, 하나만 나쁘면 DEGRADED.
     */
    @Override
    public HealthState healthCheck() {
        HealthState spotHealth = spot.healthCheck();
        HealthState onDemandHealth = onDemand.healthCheck();
        if (spotHealth == HealthState.UNHEALTHY && onDemandHealth == HealthState.UNHEALTHY) {
            return HealthState.UNHEALTHY;
        }
        if (spotHealth == HealthState.HEALTHY && onDemandHealth == HealthState.HEALTHY) {
            return HealthState.HEALTHY;
        }
        return HealthState.DEGRADED;
    }

    private CloudBackend backendFor(String leg) {
        return SPOT.equals(leg) ? spot : onDemand;
    }
}
