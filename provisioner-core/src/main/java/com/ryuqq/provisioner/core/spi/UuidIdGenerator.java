package com.ryuqq.provisioner.core.spi;

import java.util.UUID;

/**
 * 랜덤 UUID 기반 기본 ID 생성기.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class UuidIdGenerator implements IdGenerator {

    @Override
    public String nextId() {
        return UUID.randomUUID().toString();
    }
}
