package com.ryuqq.provisioner.core.exception;

/**
 * 낙관적 동시성 검사 실패.
 *
 * <p>호출자가 기대한 버전과 저장된 버전이 다릅니다. 호출자는 Aggregate를 다시 읽고
 * 결정을 재적용해야 하며, 이 예외는 최종 호출자에게 노출되지 않습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class ConcurrencyConflictException extends ProvisioningException {

    private final String aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(String aggregateId, long expectedVersion, long actualVersion) {
        super(ErrorKind.CONCURRENCY_CONFLICT, String.format(
            "Version conflict on %s (expected: %d, actual: %d)", aggregateId, expectedVersion, actualVersion));
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
