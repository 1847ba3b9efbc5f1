package com.ryuqq.provisioner.core.event;

import java.time.Instant;

final class EventHeaders {

    private EventHeaders() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static void require(String eventId, Object aggregateId, Instant occurredAt) {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("eventId cannot be null or blank");
        }
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId cannot be null");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
    }
}
