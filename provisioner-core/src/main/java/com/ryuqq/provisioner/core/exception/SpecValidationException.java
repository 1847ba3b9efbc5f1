package com.ryuqq.provisioner.core.exception;

/**
 * 해석된 스펙이 백엔드 타입의 필수 최상위 키를 갖추지 못함.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class SpecValidationException extends TemplateResolutionException {

    public SpecValidationException(String message) {
        super(message);
    }

    public SpecValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
