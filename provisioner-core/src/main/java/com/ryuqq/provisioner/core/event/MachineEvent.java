package com.ryuqq.provisioner.core.event;

import com.ryuqq.provisioner.core.model.MachineId;

/**
 * Machine Aggregate 이벤트.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public sealed interface MachineEvent extends DomainEvent
    permits MachineRegistered, MachineObserved, MachineResultSettled, MachineReturnRequested {

    MachineId machineId();

    @Override
    default String aggregateId() {
        return machineId().getValue();
    }
}
