package com.ryuqq.provisioner.application.runtime;

/**
 * 백그라운드 Reconcile 런타임.
 *
 * <p>백엔드를 polling하여 진행 중인 Request를 앞으로 진행시킵니다. {@link #pump()} 한 번이
 * 한 주기이며, 반복 호출은 호출자(스케줄러 또는 전용 스레드)가 담당합니다.</p>
 *
 * <p><strong>주기:</strong></p>
 * <pre>
 * pump()
 *   1. 활성 Request 조회
 *   2. 아무도 claim하지 않은 pending Request dispatch
 *   3. 다음 poll 시각이 된 running Request reconcile (Request별 간격 + jitter)
 *   4. reconcile한 Request 재예약
 * </pre>
 *
 * <p><strong>에러 처리:</strong> Request 하나의 처리 실패는 로그만 남기고 다음 Request로 넘어갑니다.
 * 항목 하나의 실패로 루프가 멈추지 않습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Reconcile 주기 1회 실행.
     *
     * @return 이번 주기에 처리한 Request 수
     */
    int pump();
}
