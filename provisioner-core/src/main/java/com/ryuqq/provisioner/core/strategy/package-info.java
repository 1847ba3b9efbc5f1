/**
 * 전략 등록과 선택.
 *
 * <p>선택 순서: capability 필터 → 건강 필터 → 제외 목록 → 선호 순서, 성공률, 지연, 우선순위.
 * 후보가 남지 않으면 마지막으로 후보를 탈락시킨 조건을 담아
 * {@link com.ryuqq.provisioner.core.exception.NoSuitableStrategyException}을 던집니다.</p>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.strategy;
