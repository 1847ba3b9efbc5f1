package com.ryuqq.provisioner.adapter.template.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mitchellbosecke.pebble.PebbleEngine;
import com.mitchellbosecke.pebble.attributes.methodaccess.BlacklistMethodAccessValidator;
import com.mitchellbosecke.pebble.error.AttributeNotFoundException;
import com.mitchellbosecke.pebble.error.ParserException;
import com.mitchellbosecke.pebble.error.PebbleException;
import com.mitchellbosecke.pebble.loader.StringLoader;
import com.mitchellbosecke.pebble.template.PebbleTemplate;
import com.ryuqq.provisioner.core.exception.RenderTimeoutException;
import com.ryuqq.provisioner.core.exception.TemplateResolutionException;
import com.ryuqq.provisioner.core.exception.TemplateSyntaxException;
import com.ryuqq.provisioner.core.exception.UndefinedVariableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Pebble 기반 raw 스펙 렌더러.
 *
 * <p><strong>Sandbox:</strong></p>
 * <ul>
 *   <li>템플릿은 문자열로만 로드하며 파일시스템 로더를 쓰지 않습니다 ({@code include}도 문자열로 해석).</li>
 *   <li>리플렉션성 메서드 호출은 {@link BlacklistMethodAccessValidator}가 차단합니다.</li>
 *   <li>정의되지 않은 변수는 strict 모드로 즉시 실패합니다 ({@code default} 필터는 예외).</li>
 *   <li>렌더링은 별도 스레드에서 {@code renderTimeoutMs} 안에 끝나야 합니다.</li>
 * </ul>
 *
 * <p>인라인 스펙은 JSON 트리를 순회하며 문자열 leaf마다 렌더링합니다. leaf 전체가 표현식 하나이고
 * 결과가 숫자 또는 boolean이면 해당 JSON 타입으로 바꿉니다. 파일 스펙은 전체 텍스트를 렌더링한 뒤
 * JSON으로 파싱합니다.</p>
 *
 * <p><strong>Thread-Safety:</strong> thread-safe. {@link #close()}로 렌더링 스레드를 정리합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class PebbleSpecRenderer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PebbleSpecRenderer.class);

    private static final Pattern SINGLE_EXPRESSION = Pattern.compile("^\\s*\\{\\{[^{}]*}}\\s*$");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final PebbleEngine engine;
    private final ObjectMapper mapper;
    private final long renderTimeoutMs;
    private final ExecutorService renderPool;

    public PebbleSpecRenderer(ObjectMapper mapper, long renderTimeoutMs) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (renderTimeoutMs <= 0) {
            throw new IllegalArgumentException("renderTimeoutMs must be positive (current: " + renderTimeoutMs + ")");
        }
        this.mapper = mapper;
        this.renderTimeoutMs = renderTimeoutMs;
        this.engine = new PebbleEngine.Builder()
            .loader(new StringLoader())
            .strictVariables(true)
            .autoEscaping(false)
            .newLineTrimming(false)
            .cacheActive(false)
            .methodAccessValidator(new BlacklistMethodAccessValidator())
            .extension(new SpecFilterExtension(mapper))
            .build();
        AtomicInteger counter = new AtomicInteger();
        this.renderPool = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "spec-render-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 텍스트 하나 렌더링.
     *
     * @param source 템플릿 텍스트
     * @param variables 컨텍스트 변수
     * @param origin 오류 메시지에 쓸 출처 (템플릿 ID, 파일 경로 등)
     * @return 렌더링 결과
     * @throws UndefinedVariableException 값도 기본값도 없는 변수 참조
     * @throws TemplateSyntaxException 템플릿 문법 오류
     * @throws RenderTimeoutException 렌더링 시간 초과
     */
    public String renderText(String source, Map<String, Object> variables, String origin) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (!source.contains("{{") && !source.contains("{%")) {
            return source;
        }
        Future<String> future = renderPool.submit(() -> evaluate(source, variables));
        try {
            return future.get(renderTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new RenderTimeoutException("Rendering " + origin + " exceeded " + renderTimeoutMs + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TemplateResolutionException("Interrupted while rendering " + origin, e);
        } catch (ExecutionException e) {
            throw translate(e.getCause(), origin);
        }
    }

    private String evaluate(String source, Map<String, Object> variables) throws IOException {
        PebbleTemplate template = engine.getTemplate(source);
        StringWriter writer = new StringWriter();
        template.evaluate(writer, new LinkedHashMap<>(variables));
        return writer.toString();
    }

    private TemplateResolutionException translate(Throwable cause, String origin) {
        if (cause instanceof AttributeNotFoundException) {
            return new UndefinedVariableException(
                "Undefined variable in " + origin + ": " + cause.getMessage(), cause);
        }
        if (cause instanceof ParserException) {
            return new TemplateSyntaxException("Template syntax error in " + origin + ": " + cause.getMessage(), cause);
        }
        if (cause instanceof PebbleException) {
            return new TemplateSyntaxException("Failed to render " + origin + ": " + cause.getMessage(), cause);
        }
        log.error("Unexpected failure rendering {}", origin, cause);
        return new TemplateResolutionException("Failed to render " + origin + ": " + cause, cause);
    }

    /**
     * 인라인 스펙의 모든 문자열 leaf 렌더링.
     *
     * @return 렌더링된 새 Map (입력은 변경하지 않음)
     */
    public Map<String, Object> renderTree(Map<String, Object> spec, Map<String, Object> variables, String origin) {
        Map<String, Object> rendered = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : spec.entrySet()) {
            rendered.put(entry.getKey(), renderNode(entry.getValue(), variables, origin + "." + entry.getKey()));
        }
        return rendered;
    }

    private Object renderNode(Object node, Map<String, Object> variables, String origin) {
        if (node instanceof Map) {
            Map<String, Object> object = new LinkedHashMap<>();
            ((Map<?, ?>) node).forEach((key, value) -> object.put(String.valueOf(key), value));
            return renderTree(object, variables, origin);
        }
        if (node instanceof List) {
            List<Object> items = new ArrayList<>();
            int index = 0;
            for (Object item : (List<?>) node) {
                items.add(renderNode(item, variables, origin + "[" + index++ + "]"));
            }
            return items;
        }
        if (node instanceof String) {
            String source = (String) node;
            String output = renderText(source, variables, origin);
            return SINGLE_EXPRESSION.matcher(source).matches() ? coerceScalar(output) : output;
        }
        return node;
    }

    private Object coerceScalar(String output) {
        try {
            JsonNode parsed = mapper.readTree(output);
            if (parsed != null && parsed.isNumber()) {
                return parsed.numberValue();
            }
            if (parsed != null && parsed.isBoolean()) {
                return parsed.booleanValue();
            }
        } catch (JsonProcessingException e) {
            log.trace("Rendered value is not a JSON scalar, keeping text: {}", output);
        }
        return output;
    }

    /**
     * 파일 스펙 텍스트를 렌더링한 뒤 JSON 객체로 파싱.
     *
     * @throws TemplateSyntaxException 렌더링 결과가 JSON 객체가 아닌 경우
     */
    public Map<String, Object> renderDocument(String source, Map<String, Object> variables, String origin) {
        String rendered = renderText(source, variables, origin);
        try {
            Map<String, Object> document = mapper.readValue(rendered, MAP_TYPE);
            if (document == null) {
                throw new TemplateSyntaxException("Rendered spec " + origin + " is empty");
            }
            return document;
        } catch (JsonProcessingException e) {
            throw new TemplateSyntaxException(
                "Rendered spec " + origin + " is not a JSON object: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public void close() {
        renderPool.shutdownNow();
    }
}
