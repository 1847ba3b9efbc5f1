package com.ryuqq.provisioner.adapter.runner.resilience;

/**
 * Exponential Backoff 계산기.
 *
 * <p>재시도 간격을 {@link RetryPolicy#multiplier()}만큼 증가시키고 {@link RetryPolicy#maxDelayMs()}에서 멈춥니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(initialDelay * multiplier^(attempt-1), maxDelay)
 * </pre>
 *
 * <p><strong>예시 (initialDelay=200ms, multiplier=2.0, maxDelay=5000ms):</strong></p>
 * <ul>
 *   <li>attempt=1: 200ms</li>
 *   <li>attempt=2: 400ms</li>
 *   <li>attempt=3: 800ms</li>
 *   <li>attempt=10: 5000ms (상한)</li>
 * </ul>
 *
 * <p>Jitter를 더하지 않으므로 각 대기 시간은 상한에 닿기 전까지 직전 대기 시간 × multiplier와 같습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final RetryPolicy policy;

    /**
     * @param policy 재시도 정책
     * @throws IllegalArgumentException policy가 null인 경우
     */
    public BackoffCalculator(RetryPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.policy = policy;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attemptCount 직전까지 실패한 시도 횟수 (1부터 시작)
     * @return 다음 시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public long calculate(int attemptCount) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException(
                "attemptCount must be positive (current: " + attemptCount + ")"
            );
        }

        // double 연산 후 상한 적용 (overflow 방지)
        double raw = policy.initialDelayMs() * Math.pow(policy.multiplier(), attemptCount - 1);
        return raw >= policy.maxDelayMs() ? policy.maxDelayMs() : (long) raw;
    }
}
