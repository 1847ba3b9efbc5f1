package com.ryuqq.provisioner.adapter.json.mapper;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.FromStringDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.ryuqq.provisioner.core.event.MachineEvent;
import com.ryuqq.provisioner.core.event.RequestEvent;
import com.ryuqq.provisioner.core.model.MachineId;
import com.ryuqq.provisioner.core.model.RequestId;
import com.ryuqq.provisioner.core.model.TemplateId;
import com.ryuqq.provisioner.core.spi.BackendHandle;

import java.util.function.Function;

/**
 * Provisioner 도메인 타입용 Jackson 모듈.
 *
 * <p>ID 값 객체는 원시 문자열로 직렬화하고, sealed 이벤트/핸들 계층은 mix-in으로
 * 타입 이름을 붙여 다형 역직렬화를 지원합니다. core 모듈은 Jackson에 의존하지 않습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class ProvisionerJacksonModule extends SimpleModule {

    private static final long serialVersionUID = 1L;

    public ProvisionerJacksonModule() {
        super("ProvisionerJacksonModule");

        addSerializer(RequestId.class, ToStringSerializer.instance);
        addSerializer(MachineId.class, ToStringSerializer.instance);
        addSerializer(TemplateId.class, ToStringSerializer.instance);
        addDeserializer(RequestId.class, new IdDeserializer<>(RequestId.class, RequestId::of));
        addDeserializer(MachineId.class, new IdDeserializer<>(MachineId.class, MachineId::of));
        addDeserializer(TemplateId.class, new IdDeserializer<>(TemplateId.class, TemplateId::of));

        setMixInAnnotation(RequestEvent.class, RequestEventMixin.class);
        setMixInAnnotation(MachineEvent.class, MachineEventMixin.class);
        setMixInAnnotation(BackendHandle.class, BackendHandleMixin.class);
    }

    private static final class IdDeserializer<T> extends FromStringDeserializer<T> {

        private static final long serialVersionUID = 1L;

        private final transient Function<String, T> factory;

        private IdDeserializer(Class<T> type, Function<String, T> factory) {
            super(type);
            this.factory = factory;
        }

        @Override
        protected T _deserialize(String value, DeserializationContext ctxt) {
            return factory.apply(value);
        }
    }
}
