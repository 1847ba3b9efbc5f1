package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.template.ResolvedSpec;

import java.util.List;

/**
 * 클라우드 백엔드 SPI (전략 하나당 구현체 하나).
 *
 * <p>fleet, scaling group, 직접 인스턴스 기동 등 구체적인 프로비저닝 메커니즘을 하나의
 * 인터페이스로 감쌉니다. 모든 부수 효과(클라우드 API 호출)는 구현체 안에서만 발생합니다.</p>
 *
 * <p><strong>예외 계약:</strong></p>
 * <ul>
 *   <li>일시적 오류(네트워크, 타임아웃, 스로틀링): {@code TransientBackendException}</li>
 *   <li>영구 오류(인증, 잘못된 파라미터, 쿼터): {@code PermanentBackendException}</li>
 *   <li>그 외 예외는 호출 측에서 영구 오류로 분류됩니다.</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface CloudBackend {

    /**
     * 머신 프로비저닝 요청.
     *
     * @param spec 해석된 백엔드 페이로드
     * @param count 요청 머신 수 (양수)
     * @return 나중에 상태를 조회할 핸들
     */
    ProvisioningHandle provision(ResolvedSpec spec, int count);

    /**
     * 핸들에 속한 머신 상태 조회.
     *
     * @param handle provision 또는 terminate 핸들
     * @return 현재 관측된 머신 목록 (요청 수보다 적을 수 있음)
     */
    List<MachineStatusReport> pollStatus(BackendHandle handle);

    /**
     * 머신 종료 요청.
     *
     * @param resourceIds 종료할 클라우드 리소스 ID
     * @return 종료 진행을 조회할 핸들
     */
    TerminationHandle terminate(List<String> resourceIds);

    /**
     * 백엔드 건강 상태 확인.
     *
     * @return 건강 상태
     */
    HealthState healthCheck();
}
