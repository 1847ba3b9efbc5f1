package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.model.MachineStatus;

import java.time.Instant;

/**
 * pollStatus가 반환하는 머신 단위 관측 결과.
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param resourceId 클라우드 리소스 ID
 * @param status 관측된 상태
 * @param name 호스트 이름 (nullable)
 * @param privateIpAddress 사설 IP (nullable)
 * @param publicIpAddress 공인 IP (nullable)
 * @param launchTime 기동 시각 (nullable)
 * @param message 백엔드 메시지 (nullable)
 */
public record MachineStatusReport(
    String resourceId,
    MachineStatus status,
    String name,
    String privateIpAddress,
    String publicIpAddress,
    Instant launchTime,
    String message
) {

    public MachineStatusReport {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceId cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    public static MachineStatusReport of(String resourceId, MachineStatus status) {
        return new MachineStatusReport(resourceId, status, null, null, null, null, null);
    }
}
