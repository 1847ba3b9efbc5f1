package com.ryuqq.provisioner.core.template;

import com.ryuqq.provisioner.core.model.Request;
import com.ryuqq.provisioner.core.model.RequestId;
import com.ryuqq.provisioner.core.model.TemplateId;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 템플릿 렌더링에 주입되는 런타임 값.
 *
 * <p>표준 변수 request_id, requested_count, template_id, timestamp를 제공하며,
 * extra는 호출자가 덧붙이는 추가 변수입니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record RuntimeContext(
    RequestId requestId,
    int requestedCount,
    TemplateId templateId,
    Instant timestamp,
    Map<String, Object> extra
) {

    public RuntimeContext {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        if (requestedCount <= 0) {
            throw new IllegalArgumentException("requestedCount must be positive (current: " + requestedCount + ")");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    public static RuntimeContext of(Request request, Instant now) {
        return new RuntimeContext(request.id(), request.requestedCount(), request.templateId(), now, Map.of());
    }

    /**
     * 표준 변수 Map.
     *
     * @return snake_case 변수 (extra 포함, extra가 표준 변수를 덮어쓰지 않음)
     */
    public Map<String, Object> standardVariables() {
        Map<String, Object> vars = new LinkedHashMap<>(extra);
        vars.put("request_id", requestId.getValue());
        vars.put("requested_count", requestedCount);
        vars.put("template_id", templateId == null ? null : templateId.getValue());
        vars.put("timestamp", timestamp.toString());
        return vars;
    }
}
