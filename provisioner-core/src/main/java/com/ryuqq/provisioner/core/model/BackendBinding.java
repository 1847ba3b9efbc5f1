package com.ryuqq.provisioner.core.model;

import com.ryuqq.provisioner.core.spi.BackendHandle;

/**
 * Request와 백엔드 작업의 연결 (전략 이름 + 핸들).
 *
 * <p>반환 요청은 머신이 속한 전략별로 하나씩 가질 수 있습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param strategyName 전략 이름
 * @param handle 백엔드 핸들
 */
public record BackendBinding(String strategyName, BackendHandle handle) {

    public BackendBinding {
        if (strategyName == null || strategyName.isBlank()) {
            throw new IllegalArgumentException("strategyName cannot be null or blank");
        }
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
    }
}
