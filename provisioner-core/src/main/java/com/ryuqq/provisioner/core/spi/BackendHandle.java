package com.ryuqq.provisioner.core.spi;

import java.util.List;
import java.util.Map;

/**
 * 비동기 백엔드 작업을 나중에 다시 조회하기 위한 핸들.
 *
 * <p>Request에 기록되어 영속화되며, reconcile 시 {@link CloudBackend#pollStatus(BackendHandle)}에
 * 그대로 전달됩니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public sealed interface BackendHandle permits ProvisioningHandle, TerminationHandle {

    /**
     * 백엔드가 부여한 작업 식별자 (fleet id, ASG 이름, reservation id 등).
     *
     * @return 핸들 식별자
     */
    String handleId();

    /**
     * 현재까지 알려진 클라우드 리소스 ID 목록.
     *
     * @return 리소스 ID 목록 (비동기 백엔드는 빈 목록일 수 있음)
     */
    List<String> resourceIds();

    /**
     * 백엔드별 부가 정보.
     *
     * @return 메타데이터
     */
    Map<String, String> metadata();
}
