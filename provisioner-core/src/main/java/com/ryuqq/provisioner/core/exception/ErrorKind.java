package com.ryuqq.provisioner.core.exception;

/**
 * 오류 분류.
 *
 * <p>사용자에게 노출되는 모든 실패는 사람이 읽을 수 있는 메시지와 함께
 * 원인 분류(ErrorKind)를 갖습니다.</p>
 *
 * <ul>
 *   <li>CONFIGURATION: 잘못된 템플릿, 상호 배타적 스펙 필드, 누락된 파일 (요청 생성 전 즉시 노출)</li>
 *   <li>RESOLUTION: 템플릿 렌더링/병합 실패 (dispatch 시점, Request → FAILED)</li>
 *   <li>TRANSIENT_BACKEND: 타임아웃, 스로틀링 (재시도 대상)</li>
 *   <li>PERMANENT_BACKEND: 인증, 잘못된 파라미터, 쿼터 (재시도 없음)</li>
 *   <li>BACKEND_UNAVAILABLE: Circuit Breaker OPEN (일시적 사용 불가)</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum ErrorKind {

    CONFIGURATION,
    RESOLUTION,
    TRANSIENT_BACKEND,
    PERMANENT_BACKEND,
    BACKEND_UNAVAILABLE,
    CONCURRENCY_CONFLICT,
    NOT_FOUND,
    INVALID_STATE,
    NO_SUITABLE_STRATEGY,
    CANCELLED,
    TIMEOUT
}
