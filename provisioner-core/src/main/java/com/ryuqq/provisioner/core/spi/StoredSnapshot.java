package com.ryuqq.provisioner.core.spi;

/**
 * 버전이 붙은 현재 상태 스냅샷.
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param snapshot 스냅샷 (이벤트 로그의 left-fold 결과)
 * @param version 스냅샷에 반영된 이벤트 수
 * @param <S> 스냅샷 타입
 */
public record StoredSnapshot<S>(S snapshot, long version) {

    public StoredSnapshot {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        if (version < 0) {
            throw new IllegalArgumentException("version cannot be negative (current: " + version + ")");
        }
    }
}
