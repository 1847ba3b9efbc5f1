package com.ryuqq.provisioner.application.facade;

/**
 * 머신 상태 항목.
 *
 * @param machineId 머신 ID
 * @param name 호스트 이름
 * @param result executing, succeed, fail
 * @param status pending, running, stopping, terminated, failed
 * @param privateIpAddress 사설 IP
 * @param publicIpAddress 공인 IP
 * @param launchtime 기동 시각 (epoch seconds, 미기동이면 0)
 * @param message 메시지
 */
public record MachineView(
    String machineId,
    String name,
    String result,
    String status,
    String privateIpAddress,
    String publicIpAddress,
    long launchtime,
    String message
) {
}
