package com.ryuqq.provisioner.core.spi;

/**
 * 고유 식별자 생성기.
 *
 * <p>이벤트 ID, 요청 ID, 머신 ID 생성에 사용되며 테스트에서는 결정적 구현으로 교체합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface IdGenerator {

    /**
     * 새 고유 ID 생성.
     *
     * @return 영숫자와 하이픈으로 구성된 고유 문자열
     */
    String nextId();
}
