package com.ryuqq.provisioner.application.facade;

import java.util.List;

/**
 * Request 상태.
 *
 * @param requestId Request ID
 * @param status Request 상태 (소문자)
 * @param message 메시지
 * @param machines 머신 상태 목록
 */
public record RequestStatusView(String requestId, String status, String message, List<MachineView> machines) {

    public RequestStatusView {
        machines = machines == null ? List.of() : List.copyOf(machines);
    }
}
