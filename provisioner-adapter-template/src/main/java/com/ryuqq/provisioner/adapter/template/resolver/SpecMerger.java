package com.ryuqq.provisioner.adapter.template.resolver;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 스펙 깊은 병합.
 *
 * <p>두 쪽 모두 Map인 키는 재귀적으로 병합하고, 그 외(리스트, 스칼라, Map과 스칼라의 충돌)는
 * overlay 값이 이깁니다. 입력 Map은 변경하지 않습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class SpecMerger {

    private SpecMerger() {
    }

    public static Map<String, Object> deepMerge(Map<String, Object> base, Map<String, Object> overlay) {
        Map<String, Object> merged = new LinkedHashMap<>(base);
        for (Map.Entry<String, Object> entry : overlay.entrySet()) {
            Object existing = merged.get(entry.getKey());
            Object incoming = entry.getValue();
            if (existing instanceof Map && incoming instanceof Map) {
                merged.put(entry.getKey(),
                    deepMerge(stringKeyed((Map<?, ?>) existing), stringKeyed((Map<?, ?>) incoming)));
            } else {
                merged.put(entry.getKey(), incoming);
            }
        }
        return merged;
    }

    /**
     * JSON 객체 노드를 문자열 키 Map으로 복사.
     */
    static Map<String, Object> stringKeyed(Map<?, ?> node) {
        Map<String, Object> copy = new LinkedHashMap<>();
        node.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }
}
