package com.ryuqq.provisioner.core.protection;

/**
 * 보호 대상 백엔드 호출 종류.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum BackendOperation {

    PROVISION,
    POLL,
    TERMINATE,
    HEALTH_CHECK
}
