package com.ryuqq.provisioner.core.template;

import com.ryuqq.provisioner.core.model.BackendType;
import com.ryuqq.provisioner.core.model.PriceType;
import com.ryuqq.provisioner.core.model.TemplateId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 백엔드로 전송할 최종 페이로드.
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param templateId 원본 템플릿
 * @param backendType 대상 백엔드 유형
 * @param priceType 가격 유형
 * @param payload 백엔드 API 키 기준 페이로드
 * @param baseAttributesOnly 해석 실패로 기본 속성만 사용했는지 여부
 */
public record ResolvedSpec(
    TemplateId templateId,
    BackendType backendType,
    PriceType priceType,
    Map<String, Object> payload,
    boolean baseAttributesOnly
) {

    public ResolvedSpec {
        if (templateId == null) {
            throw new IllegalArgumentException("templateId cannot be null");
        }
        if (backendType == null) {
            throw new IllegalArgumentException("backendType cannot be null");
        }
        if (priceType == null) {
            throw new IllegalArgumentException("priceType cannot be null");
        }
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public Object get(String key) {
        return payload.get(key);
    }
}
