package com.ryuqq.provisioner.adapter.template.catalog;

import com.ryuqq.provisioner.core.model.Template;
import com.ryuqq.provisioner.core.model.TemplateId;
import com.ryuqq.provisioner.core.spi.ConfigSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.attribute.FileTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 템플릿 목록을 캐싱하는 {@link ConfigSource} decorator.
 *
 * <p>다음 경우에 다시 로드합니다:</p>
 * <ul>
 *   <li>{@link #refresh()} 명시 호출</li>
 *   <li>templates.json 수정 시각이 캐시 시점과 달라진 경우</li>
 * </ul>
 *
 * <p>raw 스펙 파일은 캐싱하지 않습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class CachingTemplateCatalog implements ConfigSource {

    private static final Logger log = LoggerFactory.getLogger(CachingTemplateCatalog.class);

    private final JsonFileConfigSource source;
    private volatile Snapshot snapshot;

    public CachingTemplateCatalog(JsonFileConfigSource source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        this.source = source;
    }

    @Override
    public Optional<Template> loadTemplate(TemplateId templateId) {
        if (templateId == null) {
            throw new IllegalArgumentException("templateId cannot be null");
        }
        return Optional.ofNullable(current().byId().get(templateId));
    }

    @Override
    public List<Template> loadTemplates() {
        return List.copyOf(current().byId().values());
    }

    @Override
    public String loadRawSpec(String path) {
        return source.loadRawSpec(path);
    }

    /**
     * 캐시를 비워 다음 조회 때 다시 로드.
     */
    public void refresh() {
        snapshot = null;
        log.info("Template catalog cache invalidated");
    }

    private Snapshot current() {
        Optional<FileTime> modified = source.lastModified();
        Snapshot cached = snapshot;
        if (cached != null && cached.modified().equals(modified)) {
            return cached;
        }
        synchronized (this) {
            cached = snapshot;
            if (cached != null && cached.modified().equals(modified)) {
                return cached;
            }
            Map<TemplateId, Template> byId = new LinkedHashMap<>();
            for (Template template : source.loadTemplates()) {
                byId.put(template.templateId(), template);
            }
            Snapshot loaded = new Snapshot(Collections.unmodifiableMap(byId), modified);
            snapshot = loaded;
            if (cached != null) {
                log.info("Template catalog reloaded ({} templates)", byId.size());
            }
            return loaded;
        }
    }

    private record Snapshot(Map<TemplateId, Template> byId, Optional<FileTime> modified) {
    }
}
