package com.ryuqq.provisioner.application.facade;

/**
 * 요청 접수 결과.
 *
 * @param requestId 생성된 Request ID
 * @param message 사람이 읽을 수 있는 메시지
 */
public record RequestAcceptedView(String requestId, String message) {
}
