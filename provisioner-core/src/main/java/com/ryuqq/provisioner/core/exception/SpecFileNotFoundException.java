package com.ryuqq.provisioner.core.exception;

/**
 * 참조된 스펙 파일이 base path 아래에 존재하지 않음.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class SpecFileNotFoundException extends TemplateResolutionException {

    public SpecFileNotFoundException(String message) {
        super(message);
    }

    public SpecFileNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
