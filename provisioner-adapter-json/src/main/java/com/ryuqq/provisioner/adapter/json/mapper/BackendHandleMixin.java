package com.ryuqq.provisioner.adapter.json.mapper;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.ryuqq.provisioner.core.spi.ProvisioningHandle;
import com.ryuqq.provisioner.core.spi.TerminationHandle;

/**
 * BackendHandle 다형 직렬화 mix-in.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "handleType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ProvisioningHandle.class, name = "provisioning"),
    @JsonSubTypes.Type(value = TerminationHandle.class, name = "termination")
})
abstract class BackendHandleMixin {
}
