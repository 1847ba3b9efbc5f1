package com.ryuqq.provisioner.core.event;

import com.ryuqq.provisioner.core.model.RequestId;

/**
 * Request Aggregate 이벤트.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public sealed interface RequestEvent extends DomainEvent
    permits RequestCreated, DispatchClaimed, RequestDispatched, MachinesAttached,
            CancellationRequested, RequestSettled {

    RequestId requestId();

    @Override
    default String aggregateId() {
        return requestId().getValue();
    }
}
