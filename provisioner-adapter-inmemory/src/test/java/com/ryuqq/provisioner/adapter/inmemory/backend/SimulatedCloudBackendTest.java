package com.ryuqq.provisioner.adapter.inmemory.backend;

import com.ryuqq.provisioner.core.exception.PermanentBackendException;
import com.ryuqq.provisioner.core.model.BackendType;
import com.ryuqq.provisioner.core.model.MachineStatus;
import com.ryuqq.provisioner.core.model.PriceType;
import com.ryuqq.provisioner.core.model.TemplateId;
import com.ryuqq.provisioner.core.spi.MachineStatusReport;
import com.ryuqq.provisioner.core.spi.ProvisioningHandle;
import com.ryuqq.provisioner.core.spi.TerminationHandle;
import com.ryuqq.provisioner.core.template.ResolvedSpec;
import com.ryuqq.provisioner.testkit.fixture.MutableClock;
import com.ryuqq.provisioner.testkit.fixture.SequentialIdGenerator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimulatedCloudBackendTest {

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");

    private ResolvedSpec spec(BackendType type) {
        return new ResolvedSpec(TemplateId.of("tpl-1"), type, PriceType.ONDEMAND,
            Map.of("ImageId", "ami-1", "InstanceType", "t3.micro"), false);
    }

    @Test
    void provision_후_poll하면_RUNNING으로_전이된다() {
        // given
        SimulatedCloudBackend backend = new SimulatedCloudBackend(
            BackendType.RUN_INSTANCES, new SequentialIdGenerator("sim"), clock, 2, 0);
        ProvisioningHandle handle = backend.provision(spec(BackendType.RUN_INSTANCES), 3);

        // when
        List<MachineStatusReport> first = backend.pollStatus(handle);
        List<MachineStatusReport> second = backend.pollStatus(handle);

        // then
        assertThat(handle.resourceIds()).hasSize(3);
        assertThat(first).extracting(MachineStatusReport::status).containsOnly(MachineStatus.PENDING);
        assertThat(second).extracting(MachineStatusReport::status).containsOnly(MachineStatus.RUNNING);
        assertThat(second).allSatisfy(r -> assertThat(r.privateIpAddress()).isNotNull());
    }

    @Test
    void failEvery_배수_번째_인스턴스는_FAILED가_된다() {
        // given
        SimulatedCloudBackend backend = new SimulatedCloudBackend(
            BackendType.EC2_FLEET, new SequentialIdGenerator("sim"), clock, 1, 2);
        ProvisioningHandle handle = backend.provision(spec(BackendType.EC2_FLEET), 4);

        // when
        List<MachineStatusReport> reports = backend.pollStatus(handle);

        // then
        assertThat(reports).extracting(MachineStatusReport::status)
            .containsExactly(MachineStatus.RUNNING, MachineStatus.FAILED, MachineStatus.RUNNING, MachineStatus.FAILED);
    }

    @Test
    void terminate_후_두번_poll하면_TERMINATED가_된다() {
        // given
        SimulatedCloudBackend backend = new SimulatedCloudBackend(
            BackendType.RUN_INSTANCES, new SequentialIdGenerator("sim"), clock);
        ProvisioningHandle handle = backend.provision(spec(BackendType.RUN_INSTANCES), 1);
        backend.pollStatus(handle);

        // when
        TerminationHandle termination = backend.terminate(handle.resourceIds());
        MachineStatus afterFirst = backend.pollStatus(termination).get(0).status();
        MachineStatus afterSecond = backend.pollStatus(termination).get(0).status();

        // then
        assertThat(afterFirst).isEqualTo(MachineStatus.STOPPING);
        assertThat(afterSecond).isEqualTo(MachineStatus.TERMINATED);
    }

    @Test
    void 다른_백엔드_타입의_스펙은_영구_실패로_거부한다() {
        // given
        SimulatedCloudBackend backend = new SimulatedCloudBackend(
            BackendType.ASG, new SequentialIdGenerator("sim"), clock);

        // when & then
        assertThatThrownBy(() -> backend.provision(spec(BackendType.SPOT_FLEET), 1))
            .isInstanceOf(PermanentBackendException.class);
    }
}
