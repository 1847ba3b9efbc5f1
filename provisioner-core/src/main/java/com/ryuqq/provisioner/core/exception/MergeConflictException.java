package com.ryuqq.provisioner.core.exception;

/**
 * merge/replace 플래그가 주어진 입력과 맞지 않음 (예: raw 스펙 없는 replace 모드).
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class MergeConflictException extends TemplateResolutionException {

    public MergeConflictException(String message) {
        super(message);
    }

    public MergeConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
