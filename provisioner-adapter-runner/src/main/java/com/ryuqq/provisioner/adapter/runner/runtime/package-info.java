/**
 * 백그라운드 실행 컴포넌트.
 *
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.adapter.runner.runtime.ReconcileRuntime} - pending dispatch, running poll (Request별 jitter 일정)</li>
 *   <li>{@link com.ryuqq.provisioner.adapter.runner.runtime.Reaper} - 방치된 pending 정리, 보관 기간 지난 Request 보관 처리</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.adapter.runner.runtime;
