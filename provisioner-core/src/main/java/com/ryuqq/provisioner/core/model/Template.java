package com.ryuqq.provisioner.core.model;

import com.ryuqq.provisioner.core.exception.TemplateConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 머신 클래스를 기술하는 불변 템플릿.
 *
 * <p>기본 속성(이미지, 인스턴스 타입, 네트워크 배치)과 선택적인 raw 백엔드 스펙,
 * Launch Template 스펙, 병합 모드를 가집니다. 요청 처리 중에는 절대 변경되지 않습니다.</p>
 *
 * <p><strong>불변식:</strong> 같은 종류의 스펙(provider spec, launch template spec)을
 * 인라인과 파일 참조로 동시에 가질 수 없습니다. 위반 시
 * {@link TemplateConfigurationException}이 발생합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param templateId 템플릿 식별자
 * @param backendType 백엔드 API 유형
 * @param imageId 머신 이미지 참조
 * @param instanceType 인스턴스 크기
 * @param subnetIds 서브넷 목록
 * @param securityGroupIds 보안 그룹 목록
 * @param keyName SSH 키 이름 (nullable)
 * @param maxNumber 한 요청에서 허용되는 최대 머신 수
 * @param priceType 가격 유형
 * @param providerSpec 인라인 raw 백엔드 스펙 (nullable)
 * @param providerSpecFile raw 백엔드 스펙 파일 경로 (nullable)
 * @param launchTemplateSpec 인라인 Launch Template 스펙 (nullable)
 * @param launchTemplateSpecFile Launch Template 스펙 파일 경로 (nullable)
 * @param mergeMode 병합 모드
 * @param strategyPreference 선호 전략 이름 목록
 * @param variables 템플릿 렌더링용 사용자 정의 변수
 */
public record Template(
    TemplateId templateId,
    BackendType backendType,
    String imageId,
    String instanceType,
    List<String> subnetIds,
    List<String> securityGroupIds,
    String keyName,
    int maxNumber,
    PriceType priceType,
    Map<String, Object> providerSpec,
    String providerSpecFile,
    Map<String, Object> launchTemplateSpec,
    String launchTemplateSpecFile,
    MergeMode mergeMode,
    List<String> strategyPreference,
    Map<String, Object> variables
) {

    public Template {
        if (templateId == null) {
            throw new IllegalArgumentException("templateId cannot be null");
        }
        if (backendType == null) {
            throw new IllegalArgumentException("backendType cannot be null");
        }
        if (maxNumber <= 0) {
            throw new TemplateConfigurationException(
                "maxNumber must be positive (template: " + templateId + ", current: " + maxNumber + ")");
        }
        if (providerSpec != null && providerSpecFile != null) {
            throw new TemplateConfigurationException(
                "Template " + templateId + " declares both providerSpec and providerSpecFile");
        }
        if (launchTemplateSpec != null && launchTemplateSpecFile != null) {
            throw new TemplateConfigurationException(
                "Template " + templateId + " declares both launchTemplateSpec and launchTemplateSpecFile");
        }
        subnetIds = subnetIds == null ? List.of() : List.copyOf(subnetIds);
        securityGroupIds = securityGroupIds == null ? List.of() : List.copyOf(securityGroupIds);
        priceType = priceType == null ? PriceType.ONDEMAND : priceType;
        mergeMode = mergeMode == null ? MergeMode.MERGE : mergeMode;
        strategyPreference = strategyPreference == null ? List.of() : List.copyOf(strategyPreference);
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        providerSpec = providerSpec == null ? null : frozenObject(providerSpec);
        launchTemplateSpec = launchTemplateSpec == null ? null : frozenObject(launchTemplateSpec);
    }

    public static Builder builder(String templateId, BackendType backendType) {
        return new Builder(TemplateId.of(templateId), backendType);
    }

    /**
     * raw 스펙(provider 또는 launch template, 인라인 또는 파일)이 하나라도 있는지 확인.
     *
     * @return raw 스펙 존재 여부
     */
    public boolean hasRawSpec() {
        return providerSpec != null || providerSpecFile != null
            || launchTemplateSpec != null || launchTemplateSpecFile != null;
    }

    /**
     * 기본 속성을 백엔드 API 키로 변환.
     *
     * <p>비어 있는 속성은 포함하지 않습니다. 서브넷이 하나면 SubnetId, 여러 개면 SubnetIds로 표현합니다.</p>
     *
     * @return 백엔드 키 기준의 기본 속성 (변경 가능한 새 Map)
     */
    public Map<String, Object> baseAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        if (imageId != null) {
            attributes.put("ImageId", imageId);
        }
        if (instanceType != null) {
            attributes.put("InstanceType", instanceType);
        }
        if (subnetIds.size() == 1) {
            attributes.put("SubnetId", subnetIds.get(0));
        } else if (!subnetIds.isEmpty()) {
            attributes.put("SubnetIds", subnetIds);
        }
        if (!securityGroupIds.isEmpty()) {
            attributes.put("SecurityGroupIds", securityGroupIds);
        }
        if (keyName != null) {
            attributes.put("KeyName", keyName);
        }
        return attributes;
    }

    /**
     * 템플릿 렌더링에 노출되는 기본 속성 변수.
     *
     * @return snake_case 변수 Map
     */
    public Map<String, Object> attributeVariables() {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("image_id", imageId);
        vars.put("instance_type", instanceType);
        vars.put("subnet_ids", subnetIds);
        vars.put("security_group_ids", securityGroupIds);
        vars.put("key_name", keyName);
        return vars;
    }

    /**
     * JSON 트리의 읽기 전용 깊은 복사 (키 순서와 null 값 유지).
     */
    private static Map<String, Object> frozenObject(Map<?, ?> node) {
        Map<String, Object> copy = new LinkedHashMap<>();
        node.forEach((key, value) -> copy.put(String.valueOf(key), frozenNode(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object frozenNode(Object node) {
        if (node instanceof Map) {
            return frozenObject((Map<?, ?>) node);
        }
        if (node instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) node) {
                copy.add(frozenNode(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return node;
    }

    /**
     * Template 빌더.
     *
     * <p>설정 파일 로딩과 테스트에서 선택 필드가 많은 템플릿을 읽기 쉽게 구성합니다.</p>
     */
    public static final class Builder {

        private final TemplateId templateId;
        private final BackendType backendType;
        private String imageId;
        private String instanceType;
        private List<String> subnetIds;
        private List<String> securityGroupIds;
        private String keyName;
        private int maxNumber = 10;
        private PriceType priceType;
        private Map<String, Object> providerSpec;
        private String providerSpecFile;
        private Map<String, Object> launchTemplateSpec;
        private String launchTemplateSpecFile;
        private MergeMode mergeMode;
        private List<String> strategyPreference;
        private Map<String, Object> variables;

        private Builder(TemplateId templateId, BackendType backendType) {
            this.templateId = templateId;
            this.backendType = backendType;
        }

        public Builder imageId(String imageId) {
            this.imageId = imageId;
            return this;
        }

        public Builder instanceType(String instanceType) {
            this.instanceType = instanceType;
            return this;
        }

        public Builder subnetIds(List<String> subnetIds) {
            this.subnetIds = subnetIds;
            return this;
        }

        public Builder securityGroupIds(List<String> securityGroupIds) {
            this.securityGroupIds = securityGroupIds;
            return this;
        }

        public Builder keyName(String keyName) {
            this.keyName = keyName;
            return this;
        }

        public Builder maxNumber(int maxNumber) {
            this.maxNumber = maxNumber;
            return this;
        }

        public Builder priceType(PriceType priceType) {
            this.priceType = priceType;
            return this;
        }

        public Builder providerSpec(Map<String, Object> providerSpec) {
            this.providerSpec = providerSpec;
            return this;
        }

        public Builder providerSpecFile(String providerSpecFile) {
            this.providerSpecFile = providerSpecFile;
            return this;
        }

        public Builder launchTemplateSpec(Map<String, Object> launchTemplateSpec) {
            this.launchTemplateSpec = launchTemplateSpec;
            return this;
        }

        public Builder launchTemplateSpecFile(String launchTemplateSpecFile) {
            this.launchTemplateSpecFile = launchTemplateSpecFile;
            return this;
        }

        public Builder mergeMode(MergeMode mergeMode) {
            this.mergeMode = mergeMode;
            return this;
        }

        public Builder strategyPreference(List<String> strategyPreference) {
            this.strategyPreference = strategyPreference;
            return this;
        }

        public Builder variables(Map<String, Object> variables) {
            this.variables = variables;
            return this;
        }

        public Template build() {
            return new Template(templateId, backendType, imageId, instanceType, subnetIds, securityGroupIds,
                keyName, maxNumber, priceType, providerSpec, providerSpecFile, launchTemplateSpec,
                launchTemplateSpecFile, mergeMode, strategyPreference, variables);
        }
    }
}
