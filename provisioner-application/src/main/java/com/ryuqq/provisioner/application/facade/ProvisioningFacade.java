package com.ryuqq.provisioner.application.facade;

import java.util.List;

/**
 * 워크로드 매니저 연동용 파사드.
 *
 * <p>외부 연동이 기대하는 필드 이름(machineId, name, result, status, privateIpAddress,
 * publicIpAddress, launchtime, message)을 그대로 사용하는 뷰를 반환합니다.
 * 이 이름들은 연동 계약이므로 바꾸지 않습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface ProvisioningFacade {

    List<TemplateView> getAvailableTemplates();

    /**
     * N대의 머신 요청 (생성 후 dispatch까지 수행).
     *
     * @param templateId 템플릿 ID
     * @param count 머신 수
     * @return 생성된 Request ID와 메시지
     */
    RequestAcceptedView requestMachines(String templateId, int count);

    /**
     * Request 상태 조회.
     *
     * @param requestIds 조회할 Request ID 목록
     * @return Request별 상태 (존재하지 않는 ID는 failed와 메시지로 표시)
     */
    List<RequestStatusView> getRequestStatus(List<String> requestIds);

    /**
     * 이름(머신 ID 또는 호스트 이름)으로 지정한 머신 반환.
     *
     * @param machineNames 머신 이름 목록
     * @return 반환 Request ID와 메시지
     */
    RequestAcceptedView requestReturnMachines(List<String> machineNames);

    /**
     * 반환이 진행 중인 머신과 유예 시간 목록.
     */
    List<ReturnRequestView> getReturnRequests();
}
