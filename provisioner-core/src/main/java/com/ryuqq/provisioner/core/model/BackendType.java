package com.ryuqq.provisioner.core.model;

import java.util.List;

/**
 * 클라우드 백엔드 API 유형.
 *
 * <p>각 유형은 해석된 스펙이 반드시 갖춰야 하는 최상위 키를 정의합니다.
 * Launch Template 참조가 있으면 개별 키 대신 참조로 요구사항을 충족합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum BackendType {

    RUN_INSTANCES("RunInstances", "compute", "LaunchTemplate", List.of("ImageId", "InstanceType")),
    EC2_FLEET("EC2Fleet", "fleet", "LaunchTemplateConfigs", List.of("LaunchTemplateConfigs")),
    SPOT_FLEET("SpotFleet", "fleet", "LaunchTemplateConfigs", List.of("IamFleetRole")),
    ASG("ASG", "scaling", "LaunchTemplate", List.of("LaunchTemplate"));

    private final String apiName;
    private final String capability;
    private final String templateReferenceKey;
    private final List<String> requiredKeys;

    BackendType(String apiName, String capability, String templateReferenceKey, List<String> requiredKeys) {
        this.apiName = apiName;
        this.capability = capability;
        this.templateReferenceKey = templateReferenceKey;
        this.requiredKeys = requiredKeys;
    }

    public String getApiName() {
        return apiName;
    }

    /**
     * 이 백엔드 유형을 처리하는 전략이 갖춰야 하는 capability.
     *
     * @return capability 이름
     */
    public String getCapability() {
        return capability;
    }

    public String getTemplateReferenceKey() {
        return templateReferenceKey;
    }

    public List<String> getRequiredKeys() {
        return requiredKeys;
    }

    /**
     * API 이름 또는 enum 이름으로 조회 (대소문자 무시).
     *
     * @param name API 이름
     * @return BackendType
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    public static BackendType fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        for (BackendType type : values()) {
            if (type.apiName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown backend type: " + name);
    }
}
