/**
 * 이벤트 소싱 저장소.
 *
 * <p>{@link com.ryuqq.provisioner.core.repository.EventSourcedRepository}는 {@code EventStore} 위에서
 * Aggregate를 재구성하고, 버전 충돌 시 다시 읽고 결정을 재적용하는 {@code update} 경로를 제공합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.provisioner.core.repository;
