package com.ryuqq.provisioner.adapter.runner.backend;

import com.ryuqq.provisioner.core.exception.PermanentBackendException;
import com.ryuqq.provisioner.core.exception.TransientBackendException;
import com.ryuqq.provisioner.core.model.BackendType;
import com.ryuqq.provisioner.core.model.MachineStatus;
import com.ryuqq.provisioner.core.model.PriceType;
import com.ryuqq.provisioner.core.model.TemplateId;
import com.ryuqq.provisioner.core.spi.HealthState;
import com.ryuqq.provisioner.core.spi.MachineStatusReport;
import com.ryuqq.provisioner.core.spi.ProvisioningHandle;
import com.ryuqq.provisioner.core.spi.TerminationHandle;
import com.ryuqq.provisioner.core.template.ResolvedSpec;
import com.ryuqq.provisioner.testkit.fixture.ScriptedCloudBackend;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HeterogeneousCloudBackendTest {

    private final ScriptedCloudBackend spot = new ScriptedCloudBackend("spot", BackendType.RUN_INSTANCES);
    private final ScriptedCloudBackend onDemand = new ScriptedCloudBackend("ondemand", BackendType.RUN_INSTANCES);

    private static ResolvedSpec spec() {
        return new ResolvedSpec(TemplateId.of("tpl-mixed"), BackendType.RUN_INSTANCES, PriceType.HETEROGENEOUS,
            Map.of("ImageId", "ami-1", "InstanceType", "m5.large"), false);
    }

    @Test
    void 온디맨드_비율만큼_나누어_요청한다() {
        // given
        HeterogeneousCloudBackend backend = new HeterogeneousCloudBackend(spot, onDemand, 25);

        // when
        ProvisioningHandle handle = backend.provision(spec(), 4);

        // then
        assertThat(handle.handleId()).isEqualTo("hetero-spot-handle-1");
        assertThat(handle.requestedCount()).isEqualTo(4);
        assertThat(handle.metadata())
            .containsEntry("spot.handleId", "spot-handle-1")
            .containsEntry("spot.count", "3")
            .containsEntry("ondemand.handleId", "ondemand-handle-1")
            .containsEntry("ondemand.count", "1");
    }

    @Test
    void 스팟_요청이_실패하면_전체를_온디맨드로_요청한다() {
        // given
        spot.failNextProvision(new TransientBackendException("InsufficientInstanceCapacity"));
        HeterogeneousCloudBackend backend = new HeterogeneousCloudBackend(spot, onDemand);

        // when
        ProvisioningHandle handle = backend.provision(spec(), 3);

        // then
        assertThat(handle.handleId()).isEqualTo("hetero-ondemand-handle-1");
        assertThat(handle.requestedCount()).isEqualTo(3);
        assertThat(handle.metadata()).doesNotContainKey("spot.handleId").containsEntry("ondemand.count", "3");
    }

    @Test
    void 온디맨드만_실패하면_스팟_부분_결과를_유지한다() {
        // given
        onDemand.failNextProvision(new PermanentBackendException("VcpuLimitExceeded"));
        HeterogeneousCloudBackend backend = new HeterogeneousCloudBackend(spot, onDemand, 50);

        // when
        ProvisioningHandle handle = backend.provision(spec(), 4);

        // then
        assertThat(handle.requestedCount()).isEqualTo(2);
        assertThat(handle.metadata()).containsKey("spot.handleId").doesNotContainKey("ondemand.handleId");
    }

    @Test
    void 두_leg가_모두_실패하면_온디맨드_오류를_던진다() {
        // given
        spot.failNextProvision(new TransientBackendException("InsufficientInstanceCapacity"));
        onDemand.failNextProvision(new PermanentBackendException("VcpuLimitExceeded"));
        HeterogeneousCloudBackend backend = new HeterogeneousCloudBackend(spot, onDemand);

        // when & then
        assertThatThrownBy(() -> backend.provision(spec(), 2))
            .isInstanceOf(PermanentBackendException.class)
            .hasMessageContaining("VcpuLimitExceeded");
    }

    @Test
    void poll은_leg별_결과를_합치고_terminate는_만든_leg로_보낸다() {
        // given
        HeterogeneousCloudBackend backend = new HeterogeneousCloudBackend(spot, onDemand, 50);
        ProvisioningHandle handle = backend.provision(spec(), 2);
        spot.reportAll("spot-handle-1", 1, MachineStatus.RUNNING);
        onDemand.reportAll("ondemand-handle-1", 1, MachineStatus.RUNNING);

        // when
        List<MachineStatusReport> reports = backend.pollStatus(handle);
        TerminationHandle termination = backend.terminate(
            List.of("spot-handle-1-i-1", "ondemand-handle-1-i-1"));

        // then
        assertThat(reports).extracting(MachineStatusReport::resourceId)
            .containsExactly("spot-handle-1-i-1", "ondemand-handle-1-i-1");
        assertThat(spot.terminatedBatches()).containsExactly(List.of("spot-handle-1-i-1"));
        assertThat(onDemand.terminatedBatches()).containsExactly(List.of("ondemand-handle-1-i-1"));
        assertThat(backend.pollStatus(termination))
            .extracting(MachineStatusReport::status)
            .containsOnly(MachineStatus.TERMINATED)
            .hasSize(2);
    }

    @Test
    void 알_수_없는_리소스는_온디맨드로_종료한다() {
        // given
        HeterogeneousCloudBackend backend = new HeterogeneousCloudBackend(spot, onDemand);

        // when
        backend.terminate(List.of("i-unknown"));

        // then
        assertThat(spot.terminateCalls()).isZero();
        assertThat(onDemand.terminatedBatches()).containsExactly(List.of("i-unknown"));
    }

    @Test
    void 한_leg만_나쁘면_DEGRADED를_보고한다() {
        // given
        HeterogeneousCloudBackend backend = new HeterogeneousCloudBackend(spot, onDemand);

        // when & then
        assertThat(backend.healthCheck()).isEqualTo(HealthState.HEALTHY);
        spot.health(HealthState.UNHEALTHY);
        assertThat(backend.healthCheck()).isEqualTo(HealthState.DEGRADED);
        onDemand.health(HealthState.UNHEALTHY);
        assertThat(backend.healthCheck()).isEqualTo(HealthState.UNHEALTHY);
    }

    @Test
    void 온디맨드_비율은_0에서_100_사이여야_한다() {
        assertThatThrownBy(() -> new HeterogeneousCloudBackend(spot, onDemand, 101))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("percentOnDemand");
    }
}
