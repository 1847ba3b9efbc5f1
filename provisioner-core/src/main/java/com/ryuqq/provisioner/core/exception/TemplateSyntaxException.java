package com.ryuqq.provisioner.core.exception;

/**
 * 템플릿 문법 오류 또는 렌더링 결과가 올바른 JSON이 아님.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class TemplateSyntaxException extends TemplateResolutionException {

    public TemplateSyntaxException(String message) {
        super(message);
    }

    public TemplateSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
