package com.ryuqq.provisioner.core.exception;

/**
 * Machine 상태 또는 결과 플래그 전이 규칙 위반.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class InvalidMachineStateException extends ProvisioningException {

    public InvalidMachineStateException(String message) {
        super(ErrorKind.INVALID_STATE, message);
    }

    public InvalidMachineStateException(String message, Throwable cause) {
        super(ErrorKind.INVALID_STATE, message, cause);
    }
}
