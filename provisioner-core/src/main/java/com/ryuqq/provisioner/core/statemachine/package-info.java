/**
 * Request/Machine 상태 전이 규칙.
 *
 * <p><strong>Request 전이:</strong></p>
 * <pre>
 * pending ──► running ──► completed
 *    │           ├──────► completed_with_error
 *    │           └──────► failed
 *    └──────────────────► failed
 * </pre>
 *
 * <p>종료 상태(completed, completed_with_error, failed)에서는 어떤 전이도 허용되지 않습니다.
 * 허용되지 않은 전이는 {@link com.ryuqq.provisioner.core.exception.InvalidRequestStateException}을 던집니다.</p>
 *
 * <p><strong>Machine 결과:</strong> 관측 상태로부터 executing/succeed/fail을 도출하며,
 * 한 번 확정된 결과는 바뀌지 않습니다.</p>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.statemachine;
