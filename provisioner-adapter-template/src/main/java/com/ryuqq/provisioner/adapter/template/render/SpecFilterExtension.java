package com.ryuqq.provisioner.adapter.template.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mitchellbosecke.pebble.error.PebbleException;
import com.mitchellbosecke.pebble.extension.AbstractExtension;
import com.mitchellbosecke.pebble.extension.Filter;
import com.mitchellbosecke.pebble.template.EvaluationContext;
import com.mitchellbosecke.pebble.template.PebbleTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 스펙 렌더링 전용 필터 모음.
 *
 * <ul>
 *   <li>{@code b64encode}: UTF-8 문자열을 Base64로 인코딩 (UserData 등)</li>
 *   <li>{@code b64decode}: Base64 문자열을 UTF-8로 디코딩</li>
 *   <li>{@code round(precision=0, method='common')}: 반올림, method는 common/ceil/floor</li>
 *   <li>{@code tojson}: 값을 JSON 리터럴로 직렬화 (파일 스펙에 리스트/맵을 넣을 때)</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class SpecFilterExtension extends AbstractExtension {

    private final ObjectMapper mapper;

    public SpecFilterExtension(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    @Override
    public Map<String, Filter> getFilters() {
        Map<String, Filter> filters = new LinkedHashMap<>();
        filters.put("b64encode", new Base64EncodeFilter());
        filters.put("b64decode", new Base64DecodeFilter());
        filters.put("round", new RoundFilter());
        filters.put("tojson", new ToJsonFilter(mapper));
        return filters;
    }

    static final class Base64EncodeFilter implements Filter {

        @Override
        public List<String> getArgumentNames() {
            return List.of();
        }

        @Override
        public Object apply(Object input, Map<String, Object> args, PebbleTemplate self,
                            EvaluationContext context, int lineNumber) {
            if (input == null) {
                return null;
            }
            return Base64.getEncoder().encodeToString(input.toString().getBytes(StandardCharsets.UTF_8));
        }
    }

    static final class Base64DecodeFilter implements Filter {

        @Override
        public List<String> getArgumentNames() {
            return List.of();
        }

        @Override
        public Object apply(Object input, Map<String, Object> args, PebbleTemplate self,
                            EvaluationContext context, int lineNumber) {
            if (input == null) {
                return null;
            }
            try {
                return new String(Base64.getDecoder().decode(input.toString()), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                throw new PebbleException(e, "b64decode input is not valid Base64", lineNumber, self.getName());
            }
        }
    }

    static final class RoundFilter implements Filter {

        @Override
        public List<String> getArgumentNames() {
            return List.of("precision", "method");
        }

        @Override
        public Object apply(Object input, Map<String, Object> args, PebbleTemplate self,
                            EvaluationContext context, int lineNumber) {
            if (input == null) {
                return null;
            }
            BigDecimal value;
            try {
                value = new BigDecimal(input.toString().trim());
            } catch (NumberFormatException e) {
                throw new PebbleException(e, "round expects a number (current: " + input + ")",
                    lineNumber, self.getName());
            }
            Object precisionArg = args.get("precision");
            int precision = precisionArg == null ? 0 : ((Number) precisionArg).intValue();
            Object methodArg = args.get("method");
            String method = methodArg == null ? "common" : methodArg.toString();
            RoundingMode mode = switch (method) {
                case "common" -> RoundingMode.HALF_UP;
                case "ceil" -> RoundingMode.CEILING;
                case "floor" -> RoundingMode.FLOOR;
                default -> throw new PebbleException(null,
                    "round method must be common, ceil or floor (current: " + method + ")",
                    lineNumber, self.getName());
            };
            return value.setScale(precision, mode);
        }
    }

    static final class ToJsonFilter implements Filter {

        private final ObjectMapper mapper;

        ToJsonFilter(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public List<String> getArgumentNames() {
            return List.of();
        }

        @Override
        public Object apply(Object input, Map<String, Object> args, PebbleTemplate self,
                            EvaluationContext context, int lineNumber) {
            try {
                return mapper.writeValueAsString(input);
            } catch (JsonProcessingException e) {
                throw new PebbleException(e, "tojson could not serialize value", lineNumber, self.getName());
            }
        }
    }
}
