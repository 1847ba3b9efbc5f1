package com.ryuqq.provisioner.adapter.template.resolver;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SpecMergerTest {

    @Test
    void 리스트는_병합하지_않고_overlay로_교체한다() {
        // given
        Map<String, Object> base = Map.of("SecurityGroupIds", List.of("sg-1", "sg-2"), "KeyName", "ops");
        Map<String, Object> overlay = Map.of("SecurityGroupIds", List.of("sg-9"));

        // when
        Map<String, Object> merged = SpecMerger.deepMerge(base, overlay);

        // then
        assertThat(merged).containsEntry("SecurityGroupIds", List.of("sg-9")).containsEntry("KeyName", "ops");
    }

    @Test
    void 입력_Map은_변경되지_않는다() {
        // given
        Map<String, Object> base = new java.util.HashMap<>(Map.of("A", Map.of("x", 1)));
        Map<String, Object> overlay = Map.of("A", Map.of("y", 2));

        // when
        Map<String, Object> merged = SpecMerger.deepMerge(base, overlay);

        // then
        assertThat(merged.get("A")).isEqualTo(Map.of("x", 1, "y", 2));
        assertThat(base.get("A")).isEqualTo(Map.of("x", 1));
    }

    @Test
    void 객체와_스칼라가_충돌하면_overlay_값이_이긴다() {
        // given
        Map<String, Object> base = Map.of("Placement", Map.of("AvailabilityZone", "ap-northeast-2a"), "Monitoring", true);
        Map<String, Object> overlay = Map.of("Placement", "default", "Monitoring", Map.of("Enabled", false));

        // when
        Map<String, Object> merged = SpecMerger.deepMerge(base, overlay);

        // then
        assertThat(merged).containsEntry("Placement", "default")
            .containsEntry("Monitoring", Map.of("Enabled", false));
    }

    @Test
    void 중첩_객체는_재귀적으로_병합되고_overlay_스칼라가_우선한다() {
        // given
        Map<String, Object> base = Map.of("Placement", Map.of("AvailabilityZone", "ap-northeast-2a", "Tenancy", "default"));
        Map<String, Object> overlay = Map.of("Placement", Map.of("Tenancy", "dedicated"));

        // when
        Map<String, Object> merged = SpecMerger.deepMerge(base, overlay);

        // then
        assertThat(merged.get("Placement"))
            .isEqualTo(Map.of("AvailabilityZone", "ap-northeast-2a", "Tenancy", "dedicated"));
    }
}
