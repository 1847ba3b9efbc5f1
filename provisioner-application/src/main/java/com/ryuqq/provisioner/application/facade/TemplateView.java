package com.ryuqq.provisioner.application.facade;

import java.util.Map;

/**
 * 템플릿 목록 항목.
 *
 * @param templateId 템플릿 ID
 * @param maxNumber 최대 머신 수
 * @param attributes 표시용 속성 (type, imageId, instanceType, priceType)
 */
public record TemplateView(String templateId, int maxNumber, Map<String, Object> attributes) {
}
