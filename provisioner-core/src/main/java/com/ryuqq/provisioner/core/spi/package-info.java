/**
 * 외부 시스템 연결 지점(SPI).
 *
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.spi.CloudBackend} - provision, pollStatus, terminate, healthCheck</li>
 *   <li>{@link com.ryuqq.provisioner.core.spi.EventStore} - Aggregate 이벤트 스트림 저장소 (낙관적 동시성)</li>
 *   <li>{@link com.ryuqq.provisioner.core.spi.ConfigSource} - 템플릿과 원본 스펙 파일 조회</li>
 *   <li>{@link com.ryuqq.provisioner.core.spi.IdGenerator} - 요청/이벤트 ID 생성</li>
 * </ul>
 *
 * <p>구현체는 adapter 모듈(inmemory, json, jdbc, template)과 testkit에서 제공됩니다.</p>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.spi;
