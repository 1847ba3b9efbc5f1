/**
 * 프로비저닝 엔진 계약.
 *
 * <p>{@link com.ryuqq.provisioner.application.engine.ProvisioningEngine}은 Request 생명주기
 * (create, dispatch, reconcile, cancel, returnMachines)와 조회 연산을 정의합니다.
 * 구현체는 adapter-runner 모듈의 {@code DefaultProvisioningEngine}입니다.</p>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.application.engine;
