package com.ryuqq.provisioner.adapter.template.catalog;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ryuqq.provisioner.core.exception.TemplateConfigurationException;
import com.ryuqq.provisioner.core.model.BackendType;
import com.ryuqq.provisioner.core.model.MergeMode;
import com.ryuqq.provisioner.core.model.PriceType;
import com.ryuqq.provisioner.core.model.Template;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * templates.json 항목 하나의 JSON 표현.
 *
 * <p>camelCase 키를 기본으로 하고 snake_case 키도 허용합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record TemplateDocument(
    @JsonAlias("template_id") String templateId,
    @JsonAlias({"provider_api", "providerApi"}) String backendType,
    @JsonAlias("image_id") String imageId,
    @JsonAlias("instance_type") String instanceType,
    @JsonAlias("subnet_ids") List<String> subnetIds,
    @JsonAlias("security_group_ids") List<String> securityGroupIds,
    @JsonAlias("key_name") String keyName,
    @JsonAlias("max_number") Integer maxNumber,
    @JsonAlias("price_type") String priceType,
    @JsonAlias("provider_spec") Map<String, Object> providerSpec,
    @JsonAlias("provider_spec_file") String providerSpecFile,
    @JsonAlias("launch_template_spec") Map<String, Object> launchTemplateSpec,
    @JsonAlias("launch_template_spec_file") String launchTemplateSpecFile,
    @JsonAlias("merge_mode") String mergeMode,
    @JsonAlias("strategy_preference") List<String> strategyPreference,
    Map<String, Object> variables
) {

    /**
     * 도메인 Template으로 변환.
     *
     * @throws TemplateConfigurationException 필수 값 누락, 알 수 없는 enum 값, 상호 배타 필드 동시 지정
     */
    Template toTemplate() {
        if (templateId == null || templateId.isBlank()) {
            throw new TemplateConfigurationException("Template entry is missing templateId");
        }
        if (backendType == null) {
            throw new TemplateConfigurationException("Template " + templateId + " is missing backendType");
        }
        BackendType type;
        try {
            type = BackendType.fromName(backendType);
        } catch (IllegalArgumentException e) {
            throw new TemplateConfigurationException("Template " + templateId + ": " + e.getMessage(), e);
        }
        Template.Builder builder;
        try {
            builder = Template.builder(templateId, type);
        } catch (IllegalArgumentException e) {
            throw new TemplateConfigurationException("Invalid templateId: " + templateId, e);
        }
        builder.imageId(imageId)
            .instanceType(instanceType)
            .subnetIds(subnetIds)
            .securityGroupIds(securityGroupIds)
            .keyName(keyName)
            .priceType(parse(PriceType.class, priceType, "priceType"))
            .providerSpec(providerSpec)
            .providerSpecFile(providerSpecFile)
            .launchTemplateSpec(launchTemplateSpec)
            .launchTemplateSpecFile(launchTemplateSpecFile)
            .mergeMode(parse(MergeMode.class, mergeMode, "mergeMode"))
            .strategyPreference(strategyPreference)
            .variables(variables);
        if (maxNumber != null) {
            builder.maxNumber(maxNumber);
        }
        return builder.build();
    }

    private <T extends Enum<T>> T parse(Class<T> type, String value, String field) {
        if (value == null) {
            return null;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new TemplateConfigurationException(
                "Template " + templateId + " has unknown " + field + ": " + value, e);
        }
    }
}
