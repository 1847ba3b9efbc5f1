package com.ryuqq.provisioner.core.exception;

/**
 * 참조된 변수에 값도 기본값도 없음.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class UndefinedVariableException extends TemplateResolutionException {

    public UndefinedVariableException(String message) {
        super(message);
    }

    public UndefinedVariableException(String message, Throwable cause) {
        super(message, cause);
    }
}
