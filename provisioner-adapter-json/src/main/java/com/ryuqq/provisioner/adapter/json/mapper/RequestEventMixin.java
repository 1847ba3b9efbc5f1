package com.ryuqq.provisioner.adapter.json.mapper;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.ryuqq.provisioner.core.event.CancellationRequested;
import com.ryuqq.provisioner.core.event.DispatchClaimed;
import com.ryuqq.provisioner.core.event.MachinesAttached;
import com.ryuqq.provisioner.core.event.RequestCreated;
import com.ryuqq.provisioner.core.event.RequestDispatched;
import com.ryuqq.provisioner.core.event.RequestSettled;

/**
 * RequestEvent 다형 직렬화 mix-in.
 *
 * <p>타입 이름은 저장 포맷의 일부이므로 클래스 이름이 바뀌어도 유지해야 합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "eventType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = RequestCreated.class, name = "RequestCreated"),
    @JsonSubTypes.Type(value = DispatchClaimed.class, name = "DispatchClaimed"),
    @JsonSubTypes.Type(value = RequestDispatched.class, name = "RequestDispatched"),
    @JsonSubTypes.Type(value = MachinesAttached.class, name = "MachinesAttached"),
    @JsonSubTypes.Type(value = CancellationRequested.class, name = "CancellationRequested"),
    @JsonSubTypes.Type(value = RequestSettled.class, name = "RequestSettled")
})
abstract class RequestEventMixin {
}
