package com.ryuqq.provisioner.adapter.runner.runtime;

/**
 * Reaper 리컨실 전략.
 *
 * <p>오래 dispatch되지 않은 pending Request를 어떻게 처리할지 결정합니다.</p>
 *
 * <ul>
 *   <li>RETRY: 아무도 선점하지 않은 Request를 다시 dispatch (프로세스 재시작 등으로 놓친 경우)</li>
 *   <li>FAIL: timeout 오류로 종결</li>
 * </ul>
 *
 * <p>이미 선점되었지만 오래된 Request는 provision 호출 결과를 알 수 없으므로
 * 전략과 관계없이 FAIL로 처리합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum ReconcileStrategy {

    /**
     * 재dispatch.
     *
     * <p>백엔드 호출 전에 DispatchClaimed가 기록되므로 중복 provision 위험은 없습니다.</p>
     */
    RETRY,

    /**
     * 실패 처리 (errorKind = TIMEOUT).
     */
    FAIL
}
