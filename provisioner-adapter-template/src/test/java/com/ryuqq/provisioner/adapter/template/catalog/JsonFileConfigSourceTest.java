package com.ryuqq.provisioner.adapter.template.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.provisioner.adapter.template.resolver.DefaultTemplateResolver;
import com.ryuqq.provisioner.adapter.template.resolver.ResolverConfig;
import com.ryuqq.provisioner.core.exception.SpecFileNotFoundException;
import com.ryuqq.provisioner.core.exception.TemplateConfigurationException;
import com.ryuqq.provisioner.core.model.BackendType;
import com.ryuqq.provisioner.core.model.MergeMode;
import com.ryuqq.provisioner.core.model.PriceType;
import com.ryuqq.provisioner.core.model.RequestId;
import com.ryuqq.provisioner.core.model.Template;
import com.ryuqq.provisioner.core.model.TemplateId;
import com.ryuqq.provisioner.core.template.ResolvedSpec;
import com.ryuqq.provisioner.core.template.RuntimeContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileConfigSourceTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private Path fixtures;
    private JsonFileConfigSource source;

    @BeforeEach
    void setUp() throws URISyntaxException {
        fixtures = Path.of(getClass().getResource("/fixtures/templates.json").toURI()).getParent();
        source = JsonFileConfigSource.of(fixtures.resolve("templates.json"),
            new ResolverConfig().withBasePath(fixtures), mapper);
    }

    @Test
    void camelCase와_snake_case_항목을_모두_읽는다() {
        // when
        List<Template> templates = source.loadTemplates();

        // then
        assertThat(templates).extracting(t -> t.templateId().getValue())
            .containsExactly("basic-ondemand", "spot-fleet", "fleet-replace");
        Template spot = templates.get(1);
        assertThat(spot.backendType()).isEqualTo(BackendType.SPOT_FLEET);
        assertThat(spot.priceType()).isEqualTo(PriceType.SPOT);
        assertThat(spot.maxNumber()).isEqualTo(100);
        assertThat(spot.providerSpecFile()).isEqualTo("specs/spot-fleet.json");
        assertThat(templates.get(2).mergeMode()).isEqualTo(MergeMode.REPLACE);
    }

    @Test
    void 파일_스펙을_포함한_템플릿을_끝까지_해석한다() {
        // given
        DefaultTemplateResolver resolver = new DefaultTemplateResolver(source, new ResolverConfig(), mapper);
        Template spot = source.loadTemplate(TemplateId.of("spot-fleet")).orElseThrow();
        RuntimeContext context = new RuntimeContext(RequestId.of("req-7"), 4, spot.templateId(),
            Instant.parse("2024-01-01T00:00:00Z"), Map.of());

        // when
        ResolvedSpec spec = resolver.resolve(spot, context);

        // then
        assertThat(spec.get("IamFleetRole")).isEqualTo("arn:aws:iam::123456789012:role/fleet");
        assertThat(spec.get("TargetCapacity")).isEqualTo(4);
        assertThat(spec.get("AllocationStrategy")).isEqualTo("capacityOptimized");
        assertThat(spec.get("SubnetIds")).isEqualTo(List.of("subnet-1", "subnet-2"));
        assertThat(spec.get("InstanceType")).isEqualTo("c5.large");
    }

    @Test
    void 인라인_replace_템플릿의_단일_표현식은_숫자로_렌더링된다() {
        // given
        DefaultTemplateResolver resolver = new DefaultTemplateResolver(source, new ResolverConfig(), mapper);
        Template fleet = source.loadTemplate(TemplateId.of("fleet-replace")).orElseThrow();
        RuntimeContext context = new RuntimeContext(RequestId.of("req-8"), 6, fleet.templateId(),
            Instant.parse("2024-01-01T00:00:00Z"), Map.of());

        // when
        ResolvedSpec spec = resolver.resolve(fleet, context);

        // then
        assertThat(spec.payload()).doesNotContainKey("ImageId");
        assertThat(spec.get("TargetCapacitySpecification")).isEqualTo(Map.of("TotalTargetCapacity", 6));
    }

    @Test
    void 알_수_없는_ID는_empty() {
        // when & then
        assertThat(source.loadTemplate(TemplateId.of("nope"))).isEmpty();
    }

    @Test
    void base_path_밖의_스펙_파일은_거부한다() {
        // when & then
        assertThatThrownBy(() -> source.loadRawSpec("../../etc/passwd"))
            .isInstanceOf(SpecFileNotFoundException.class);
        assertThatThrownBy(() -> source.loadRawSpec("specs/missing.json"))
            .isInstanceOf(SpecFileNotFoundException.class);
    }

    @Test
    void 인라인과_파일_스펙을_동시에_지정하면_TemplateConfigurationException(@TempDir Path dir) throws Exception {
        // given
        Path file = dir.resolve("templates.json");
        Files.writeString(file, "{\"templates\":[{\"templateId\":\"bad\",\"backendType\":\"ASG\","
            + "\"providerSpec\":{\"a\":1},\"providerSpecFile\":\"x.json\"}]}");
        JsonFileConfigSource broken = new JsonFileConfigSource(file, dir, mapper);

        // when & then
        assertThatThrownBy(broken::loadTemplates)
            .isInstanceOf(TemplateConfigurationException.class)
            .hasMessageContaining("bad");
    }

    @Test
    void 알_수_없는_백엔드_타입과_중복_ID는_TemplateConfigurationException(@TempDir Path dir) throws Exception {
        // given
        Path unknown = dir.resolve("unknown.json");
        Files.writeString(unknown, "{\"templates\":[{\"templateId\":\"t\",\"backendType\":\"Lambda\"}]}");
        Path duplicate = dir.resolve("duplicate.json");
        Files.writeString(duplicate, "{\"templates\":["
            + "{\"templateId\":\"t\",\"backendType\":\"ASG\"},{\"templateId\":\"t\",\"backendType\":\"ASG\"}]}");

        // when & then
        assertThatThrownBy(() -> new JsonFileConfigSource(unknown, dir, mapper).loadTemplates())
            .isInstanceOf(TemplateConfigurationException.class)
            .hasMessageContaining("Lambda");
        assertThatThrownBy(() -> new JsonFileConfigSource(duplicate, dir, mapper).loadTemplates())
            .isInstanceOf(TemplateConfigurationException.class)
            .hasMessageContaining("Duplicate");
    }
}
