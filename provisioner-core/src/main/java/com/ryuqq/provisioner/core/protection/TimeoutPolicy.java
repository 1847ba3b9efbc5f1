package com.ryuqq.provisioner.core.protection;

/**
 * 백엔드 호출 종류별 타임아웃 정책 SPI.
 *
 * <p>호출 단위(dispatch 호출, poll 호출 등) 타임아웃이며, running 상태를 얼마나 허용할지 정하는
 * Request 전체 타임아웃과는 별개입니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface TimeoutPolicy {

    /**
     * 시도당 타임아웃 조회.
     *
     * @param operation 호출 종류
     * @return 타임아웃 (밀리초), 0은 타임아웃 없음
     */
    long getPerAttemptTimeoutMs(BackendOperation operation);

    /**
     * 타임아웃 발생 기록.
     *
     * @param operation 호출 종류
     * @param elapsedMs 경과 시간 (밀리초)
     */
    void recordTimeout(BackendOperation operation, long elapsedMs);
}
