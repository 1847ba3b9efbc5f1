/**
 * 프로비저닝 도메인 모델.
 *
 * <h2>Aggregate</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.model.Request} - 프로비저닝/반환 요청 (이벤트 소싱)</li>
 *   <li>{@link com.ryuqq.provisioner.core.model.Machine} - 백엔드가 만든 머신 1대 (이벤트 소싱)</li>
 * </ul>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.model.RequestId} - {@code req-}/{@code ret-} 접두사로 유형을 구분하는 식별자</li>
 *   <li>{@link com.ryuqq.provisioner.core.model.MachineId} - {@code m-} 접두사를 붙인 클라우드 리소스 ID</li>
 *   <li>{@link com.ryuqq.provisioner.core.model.TemplateId} - 템플릿 식별자</li>
 *   <li>{@link com.ryuqq.provisioner.core.model.Template} - 머신 템플릿 (설정에서 읽음, 이벤트 소싱 대상 아님)</li>
 *   <li>{@link com.ryuqq.provisioner.core.model.BackendBinding} - 전략 이름과 백엔드 핸들의 쌍</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>불변성:</strong> 모든 모델은 record 또는 final 클래스</li>
 *   <li><strong>상태 변경:</strong> {@code proposeX} 메서드가 이벤트를 제안하고 {@code record}로 적용</li>
 *   <li><strong>와이어 값:</strong> 상태 enum은 소문자 와이어 값을 가짐 ({@code getWireValue()})</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.model;
