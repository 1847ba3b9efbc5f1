package com.ryuqq.provisioner.core.template;

import com.ryuqq.provisioner.core.model.Template;

/**
 * 템플릿 해석기 계약.
 *
 * <p>템플릿의 선언적 기본 속성과 선택적 raw 백엔드 스펙(인라인 또는 파일)을
 * 렌더링과 병합 정책으로 합쳐, 백엔드에 그대로 보낼 페이로드를 만듭니다.</p>
 *
 * <p><strong>우선순위 (높음 → 낮음):</strong> 인라인 provider 스펙 → 파일 provider 스펙
 * → 인라인 launch template 스펙 → 파일 launch template 스펙 → 템플릿 기본 속성</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface TemplateResolver {

    /**
     * 템플릿 해석.
     *
     * @param template 템플릿
     * @param context 런타임 컨텍스트
     * @return 해석된 스펙
     * @throws com.ryuqq.provisioner.core.exception.TemplateResolutionException 렌더링, 병합, 검증 실패
     */
    ResolvedSpec resolve(Template template, RuntimeContext context);

    /**
     * raw 스펙을 무시하고 기본 속성만으로 스펙 생성 (해석 실패 시 fallback 용도).
     *
     * @param template 템플릿
     * @return 기본 속성만으로 만든 스펙
     */
    ResolvedSpec resolveBaseAttributes(Template template);
}
