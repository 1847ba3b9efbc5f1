package com.ryuqq.provisioner.core.exception;

/**
 * 템플릿 설정 오류 (요청은 생성되지 않음).
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class TemplateConfigurationException extends ProvisioningException {

    public TemplateConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    public TemplateConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, cause);
    }
}
