package com.ryuqq.provisioner.core.exception;

/**
 * 템플릿 해석(렌더링/병합/검증) 실패.
 *
 * <p>dispatch 시점에 발생하며, 호출자 정책에 따라 기본 속성만으로 대체(fallback)하거나
 * Request를 FAILED로 종결합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class TemplateResolutionException extends ProvisioningException {

    public TemplateResolutionException(String message) {
        super(ErrorKind.RESOLUTION, message);
    }

    public TemplateResolutionException(String message, Throwable cause) {
        super(ErrorKind.RESOLUTION, message, cause);
    }
}
