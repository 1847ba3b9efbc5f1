package com.ryuqq.provisioner.adapter.jdbc;

/**
 * JDBC 접근 실패를 감싸는 unchecked 예외.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class JdbcEventStoreException extends RuntimeException {

    public JdbcEventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
