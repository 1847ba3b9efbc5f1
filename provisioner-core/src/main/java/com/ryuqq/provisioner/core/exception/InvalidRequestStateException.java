package com.ryuqq.provisioner.core.exception;

/**
 * Request 상태 전이 규칙 위반 (예: pending이 아닌 Request의 dispatch).
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class InvalidRequestStateException extends ProvisioningException {

    public InvalidRequestStateException(String message) {
        super(ErrorKind.INVALID_STATE, message);
    }

    public InvalidRequestStateException(String message, Throwable cause) {
        super(ErrorKind.INVALID_STATE, message, cause);
    }
}
