package com.ryuqq.provisioner.adapter.template.resolver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.provisioner.adapter.template.render.PebbleSpecRenderer;
import com.ryuqq.provisioner.core.exception.MergeConflictException;
import com.ryuqq.provisioner.core.exception.SpecValidationException;
import com.ryuqq.provisioner.core.model.BackendType;
import com.ryuqq.provisioner.core.model.MergeMode;
import com.ryuqq.provisioner.core.model.Template;
import com.ryuqq.provisioner.core.spi.ConfigSource;
import com.ryuqq.provisioner.core.template.ResolvedSpec;
import com.ryuqq.provisioner.core.template.RuntimeContext;
import com.ryuqq.provisioner.core.template.TemplateResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 기본 템플릿 해석기.
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>렌더링 변수 구성: 기본 속성 변수 → 템플릿 custom 변수 → 표준 변수(request_id 등) 순으로 덮어씀.
 *       값이 null인 변수는 정의되지 않은 것으로 취급합니다.</li>
 *   <li>raw 스펙 렌더링: 인라인은 트리 단위, 파일은 ConfigSource에서 읽어 텍스트 단위.</li>
 *   <li>병합: 낮은 우선순위부터 깊은 병합. MERGE는 기본 속성 위에, REPLACE는 빈 Map 위에 쌓습니다.</li>
 *   <li>검증: raw 스펙이 있으면 백엔드 유형의 필수 키 또는 launch template 참조 키가 있어야 하고,
 *       없으면 최소한 ImageId가 있어야 합니다.</li>
 * </ol>
 *
 * <p><strong>우선순위 (낮음 → 높음):</strong> 기본 속성, 파일 launch template 스펙, 인라인 launch template 스펙,
 * 파일 provider 스펙, 인라인 provider 스펙</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class DefaultTemplateResolver implements TemplateResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultTemplateResolver.class);

    private final ConfigSource configSource;
    private final PebbleSpecRenderer renderer;
    private final ResolverConfig config;

    public DefaultTemplateResolver(ConfigSource configSource, ResolverConfig config, ObjectMapper mapper) {
        this(configSource, new PebbleSpecRenderer(mapper, config.renderTimeoutMs()), config);
    }

    public DefaultTemplateResolver(ConfigSource configSource, PebbleSpecRenderer renderer, ResolverConfig config) {
        if (configSource == null) {
            throw new IllegalArgumentException("configSource cannot be null");
        }
        if (renderer == null) {
            throw new IllegalArgumentException("renderer cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.configSource = configSource;
        this.renderer = renderer;
        this.config = config;
    }

    @Override
    public ResolvedSpec resolve(Template template, RuntimeContext context) {
        if (template == null) {
            throw new IllegalArgumentException("template cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (template.mergeMode() == MergeMode.REPLACE && !template.hasRawSpec()) {
            throw new MergeConflictException(
                "Template " + template.templateId() + " uses replace mode but declares no raw spec");
        }

        Map<String, Object> variables = variablesFor(template, context);
        String id = template.templateId().getValue();

        List<Map<String, Object>> layers = new ArrayList<>(4);
        if (template.launchTemplateSpecFile() != null) {
            layers.add(renderer.renderDocument(configSource.loadRawSpec(template.launchTemplateSpecFile()),
                variables, id + ":" + template.launchTemplateSpecFile()));
        }
        if (template.launchTemplateSpec() != null) {
            layers.add(renderer.renderTree(template.launchTemplateSpec(), variables, id + ".launchTemplateSpec"));
        }
        if (template.providerSpecFile() != null) {
            layers.add(renderer.renderDocument(configSource.loadRawSpec(template.providerSpecFile()),
                variables, id + ":" + template.providerSpecFile()));
        }
        if (template.providerSpec() != null) {
            layers.add(renderer.renderTree(template.providerSpec(), variables, id + ".providerSpec"));
        }

        Map<String, Object> payload = template.mergeMode() == MergeMode.MERGE
            ? template.baseAttributes()
            : new LinkedHashMap<>();
        for (Map<String, Object> layer : layers) {
            payload = SpecMerger.deepMerge(payload, layer);
        }

        validate(template, payload);
        log.debug("Resolved template {} ({} mode, {} raw layers)", id, template.mergeMode(), layers.size());
        return new ResolvedSpec(template.templateId(), template.backendType(), template.priceType(), payload, false);
    }

    @Override
    public ResolvedSpec resolveBaseAttributes(Template template) {
        if (template == null) {
            throw new IllegalArgumentException("template cannot be null");
        }
        return new ResolvedSpec(template.templateId(), template.backendType(), template.priceType(),
            template.baseAttributes(), true);
    }

    private Map<String, Object> variablesFor(Template template, RuntimeContext context) {
        Map<String, Object> variables = new LinkedHashMap<>();
        putAllNonNull(variables, template.attributeVariables());
        putAllNonNull(variables, template.variables());
        putAllNonNull(variables, context.standardVariables());
        variables.put("package_name", config.packageName());
        variables.put("package_version", config.packageVersion());
        return variables;
    }

    private static void putAllNonNull(Map<String, Object> target, Map<String, Object> source) {
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            if (entry.getValue() != null) {
                target.put(entry.getKey(), entry.getValue());
            }
        }
    }

    private static void validate(Template template, Map<String, Object> payload) {
        BackendType type = template.backendType();
        if (!template.hasRawSpec()) {
            if (!payload.containsKey("ImageId")) {
                throw new SpecValidationException(
                    "Template " + template.templateId() + " has no raw spec and no ImageId to launch from");
            }
            return;
        }
        if (payload.containsKey(type.getTemplateReferenceKey())) {
            return;
        }
        List<String> missing = new ArrayList<>();
        for (String key : type.getRequiredKeys()) {
            if (!payload.containsKey(key)) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            throw new SpecValidationException("Resolved spec for template " + template.templateId() + " ("
                + type.getApiName() + ") is missing required keys " + missing
                + " and has no " + type.getTemplateReferenceKey() + " reference");
        }
    }
}
