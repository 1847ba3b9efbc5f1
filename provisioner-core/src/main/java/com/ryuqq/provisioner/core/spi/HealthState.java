package com.ryuqq.provisioner.core.spi;

/**
 * 백엔드(전략) 건강 상태.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum HealthState {

    HEALTHY,

    /** 동작하지만 성능 저하 또는 부분 장애. 선택 대상에는 포함됩니다. */
    DEGRADED,

    UNHEALTHY
}
