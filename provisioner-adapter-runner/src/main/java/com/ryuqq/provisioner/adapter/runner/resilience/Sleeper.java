package com.ryuqq.provisioner.adapter.runner.resilience;

/**
 * 재시도 대기 추상화.
 *
 * <p>테스트에서는 실제로 잠들지 않고 요청된 대기 시간만 기록하는 구현을 주입합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * {@link Thread#sleep(long)} 기반 기본 구현.
     */
    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
