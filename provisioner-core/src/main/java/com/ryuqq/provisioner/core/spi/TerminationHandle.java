package com.ryuqq.provisioner.core.spi;

import java.util.List;
import java.util.Map;

/**
 * terminate 호출 결과 핸들.
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param handleId 백엔드 작업 식별자
 * @param resourceIds 종료 대상 리소스 ID
 * @param metadata 부가 정보
 */
public record TerminationHandle(
    String handleId,
    List<String> resourceIds,
    Map<String, String> metadata
) implements BackendHandle {

    public TerminationHandle {
        if (handleId == null || handleId.isBlank()) {
            throw new IllegalArgumentException("handleId cannot be null or blank");
        }
        if (resourceIds == null || resourceIds.isEmpty()) {
            throw new IllegalArgumentException("resourceIds cannot be null or empty");
        }
        resourceIds = List.copyOf(resourceIds);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
