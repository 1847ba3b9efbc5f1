package com.ryuqq.provisioner.adapter.json.mapper;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.ryuqq.provisioner.core.event.MachineObserved;
import com.ryuqq.provisioner.core.event.MachineRegistered;
import com.ryuqq.provisioner.core.event.MachineResultSettled;
import com.ryuqq.provisioner.core.event.MachineReturnRequested;

/**
 * MachineEvent 다형 직렬화 mix-in.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "eventType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = MachineRegistered.class, name = "MachineRegistered"),
    @JsonSubTypes.Type(value = MachineObserved.class, name = "MachineObserved"),
    @JsonSubTypes.Type(value = MachineResultSettled.class, name = "MachineResultSettled"),
    @JsonSubTypes.Type(value = MachineReturnRequested.class, name = "MachineReturnRequested")
})
abstract class MachineEventMixin {
}
