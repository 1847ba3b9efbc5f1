package com.ryuqq.provisioner.core.exception;

/**
 * 일시적 백엔드 오류 (네트워크, 타임아웃, 스로틀링). 재시도 대상입니다.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class TransientBackendException extends ProvisioningException {

    public TransientBackendException(String message) {
        super(ErrorKind.TRANSIENT_BACKEND, message);
    }

    public TransientBackendException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_BACKEND, message, cause);
    }
}
