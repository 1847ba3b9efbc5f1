package com.ryuqq.provisioner.adapter.json.mapper;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * 저장 포맷용 ObjectMapper 생성.
 *
 * <p>시각은 ISO-8601 문자열로 기록합니다. 레코드의 파생 접근자({@code isTerminal()} 등)가
 * 속성으로 기록되므로 읽을 때 알 수 없는 속성은 무시합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ProvisionerObjectMapperFactory {

    private ProvisionerObjectMapperFactory() {
    }

    public static ObjectMapper create() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .registerModule(new ProvisionerJacksonModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
    }
}
