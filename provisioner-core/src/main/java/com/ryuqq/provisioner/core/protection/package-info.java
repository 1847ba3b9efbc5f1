/**
 * 백엔드 호출 보호 계약.
 *
 * <p>Circuit Breaker와 작업별 타임아웃 정책의 인터페이스를 정의합니다. 실제 구현과 재시도 조합은
 * adapter-runner 모듈의 {@code resilience} 패키지가 담당합니다.</p>
 *
 * <p><strong>Circuit Breaker 상태:</strong></p>
 * <pre>
 * CLOSED ──(연속 실패 ≥ threshold)──► OPEN ──(recoveryTimeout 경과)──► HALF_OPEN
 *   ▲                                                                     │
 *   └──────────────(시험 호출 성공)──────────────────────────────────────────┘
 *                  (시험 호출 실패 → OPEN, 타이머 재시작)
 * </pre>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.protection;
