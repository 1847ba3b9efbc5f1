package com.ryuqq.provisioner.core.exception;

/**
 * 저장소에 해당 Aggregate가 존재하지 않음.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class AggregateNotFoundException extends ProvisioningException {

    public AggregateNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public AggregateNotFoundException(String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, message, cause);
    }
}
