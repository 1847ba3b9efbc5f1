package com.ryuqq.provisioner.application.engine;

import com.ryuqq.provisioner.core.model.Machine;
import com.ryuqq.provisioner.core.model.MachineId;
import com.ryuqq.provisioner.core.model.Request;
import com.ryuqq.provisioner.core.model.RequestId;
import com.ryuqq.provisioner.core.model.Template;
import com.ryuqq.provisioner.core.model.TemplateId;

import java.util.List;

/**
 * 프로비저닝 오케스트레이션 엔진.
 *
 * <p>Request 생명주기 상태 머신을 구동합니다. 템플릿을 해석하고, 전략을 선택하고,
 * 보호 계층을 거쳐 백엔드를 호출하고, 결과 전이를 저장소에 기록하며,
 * 이후 진행 중인 Request를 poll하여 상태를 맞춥니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * create()    → pending
 * dispatch()  → running | failed
 * reconcile() → completed | completed_with_error | failed (또는 running 유지)
 * </pre>
 *
 * <p><strong>멱등성:</strong></p>
 * <ul>
 *   <li>pending이 아닌 Request의 dispatch는 상태 변화 없이 거부됩니다.</li>
 *   <li>종료된 Request의 reconcile은 no-op입니다.</li>
 * </ul>
 *
 * <p>모든 쓰기는 낙관적 동시성 경로를 거치며, 충돌은 내부에서 다시 읽고 재적용하여
 * 호출자에게 노출되지 않습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface ProvisioningEngine {

    /**
     * 프로비저닝 Request 생성.
     *
     * @param templateId 템플릿 ID
     * @param count 요청 머신 수 (1 이상, 템플릿 maxNumber 이하)
     * @return pending 상태로 저장된 Request ID
     * @throws com.ryuqq.provisioner.core.exception.TemplateConfigurationException 템플릿이 없거나 count가 범위를 벗어난 경우
     */
    RequestId create(TemplateId templateId, int count);

    /**
     * pending Request를 백엔드로 보냄.
     *
     * @param requestId Request ID
     * @return dispatch 후 상태 (running 또는 failed)
     * @throws com.ryuqq.provisioner.core.exception.InvalidRequestStateException pending이 아니거나 이미 선점된 경우
     */
    Request dispatch(RequestId requestId);

    /**
     * running Request의 백엔드 상태를 poll하여 Machine/Request 상태 반영.
     *
     * @param requestId Request ID
     * @return 반영 후 상태 (종료된 Request는 그대로 반환)
     */
    Request reconcile(RequestId requestId);

    /**
     * 머신 반환 Request 생성 후 즉시 terminate 호출.
     *
     * @param machineIds 반환할 머신
     * @return 반환 Request ID
     */
    RequestId returnMachines(List<MachineId> machineIds);

    /**
     * 취소 표시. 다음 reconcile 패스가 처리합니다.
     *
     * @param requestId Request ID
     * @param reason 취소 사유
     * @return 취소 표시된 Request
     */
    Request cancel(RequestId requestId, String reason);

    Request getRequest(RequestId requestId);

    /**
     * Request에 연결된 머신 (연결 순서).
     */
    List<Machine> getMachines(RequestId requestId);

    /**
     * 보관 처리되지 않은 모든 머신 (등록 순서).
     */
    List<Machine> listMachines();

    /**
     * 아직 종료되지 않은 Request ID 목록.
     */
    List<RequestId> activeRequestIds();

    /**
     * 사용 가능한 템플릿 목록.
     */
    List<Template> listTemplates();
}
