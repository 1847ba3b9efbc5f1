package com.ryuqq.provisioner.core.exception;

/**
 * 프로비저닝 도메인 예외의 최상위 타입.
 *
 * <p>모든 도메인 예외는 {@link ErrorKind}를 가지며, Request가 실패로 종결될 때
 * 메시지와 함께 영속화됩니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class ProvisioningException extends RuntimeException {

    private final ErrorKind kind;

    public ProvisioningException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public ProvisioningException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    /**
     * 오류 분류 조회.
     *
     * @return 오류 분류
     */
    public ErrorKind getKind() {
        return kind;
    }
}
