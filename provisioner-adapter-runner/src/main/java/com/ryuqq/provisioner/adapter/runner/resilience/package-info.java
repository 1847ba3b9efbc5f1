/**
 * 백엔드 호출 보호 계층 구현.
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.adapter.runner.resilience.ResilientExecutor} - breaker, 재시도, 타임아웃, 호출 풀 조합</li>
 *   <li>{@link com.ryuqq.provisioner.adapter.runner.resilience.DefaultCircuitBreaker} - 전략별 Circuit Breaker</li>
 *   <li>{@link com.ryuqq.provisioner.adapter.runner.resilience.BackoffCalculator} - 지수 backoff</li>
 *   <li>{@link com.ryuqq.provisioner.adapter.runner.resilience.FailureClassifier} - 일시적/영구 오류 분류</li>
 *   <li>{@link com.ryuqq.provisioner.adapter.runner.resilience.StrategyMetricsRecorder} - 전략 선택용 호출 지표</li>
 *   <li>{@link com.ryuqq.provisioner.adapter.runner.resilience.StrategyHealthProbe} - 주기적 health check</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.adapter.runner.resilience;
