package com.ryuqq.provisioner.core.exception;

/**
 * 영구적 백엔드 오류 (인증, 잘못된 파라미터, 쿼터 초과). 재시도하지 않습니다.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class PermanentBackendException extends ProvisioningException {

    public PermanentBackendException(String message) {
        super(ErrorKind.PERMANENT_BACKEND, message);
    }

    public PermanentBackendException(String message, Throwable cause) {
        super(ErrorKind.PERMANENT_BACKEND, message, cause);
    }
}
