package com.ryuqq.provisioner.testkit.fixture;

import com.ryuqq.provisioner.core.spi.IdGenerator;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Id generator producing {@code prefix-1, prefix-2, ...}.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class SequentialIdGenerator implements IdGenerator {

    private final String prefix;
    private final AtomicLong counter = new AtomicLong();

    public SequentialIdGenerator() {
        this("id");
    }

    public SequentialIdGenerator(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be null or blank");
        }
        this.prefix = prefix;
    }

    @Override
    public String nextId() {
        return prefix + "-" + counter.incrementAndGet();
    }

    public long issued() {
        return counter.get();
    }
}
