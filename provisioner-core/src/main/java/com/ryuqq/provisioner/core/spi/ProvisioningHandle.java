package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.model.BackendType;

import java.util.List;
import java.util.Map;

/**
 * provision 호출 결과 핸들.
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param handleId 백엔드 작업 식별자
 * @param backendType 백엔드 유형
 * @param requestedCount 요청한 머신 수
 * @param resourceIds 즉시 알려진 리소스 ID
 * @param metadata 부가 정보
 */
public record ProvisioningHandle(
    String handleId,
    BackendType backendType,
    int requestedCount,
    List<String> resourceIds,
    Map<String, String> metadata
) implements BackendHandle {

    public ProvisioningHandle {
        if (handleId == null || handleId.isBlank()) {
            throw new IllegalArgumentException("handleId cannot be null or blank");
        }
        if (backendType == null) {
            throw new IllegalArgumentException("backendType cannot be null");
        }
        if (requestedCount <= 0) {
            throw new IllegalArgumentException(
                "requestedCount must be positive (current: " + requestedCount + ")");
        }
        resourceIds = resourceIds == null ? List.of() : List.copyOf(resourceIds);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
