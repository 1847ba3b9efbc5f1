package com.ryuqq.provisioner.core.exception;

/**
 * 렌더링이 허용된 시간 예산을 초과함.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class RenderTimeoutException extends TemplateResolutionException {

    public RenderTimeoutException(String message) {
        super(message);
    }

    public RenderTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
