package com.ryuqq.provisioner.adapter.template.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.provisioner.adapter.template.resolver.ResolverConfig;
import com.ryuqq.provisioner.core.exception.SpecFileNotFoundException;
import com.ryuqq.provisioner.core.exception.TemplateConfigurationException;
import com.ryuqq.provisioner.core.model.Template;
import com.ryuqq.provisioner.core.model.TemplateId;
import com.ryuqq.provisioner.core.spi.ConfigSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * templates.json 파일 기반 {@link ConfigSource}.
 *
 * <p>문서 형식: {@code {"templates": [ {...}, ... ]}}. 호출마다 파일을 다시 읽으므로
 * 캐싱이 필요하면 {@link CachingTemplateCatalog}로 감쌉니다.</p>
 *
 * <p>raw 스펙 파일 경로는 base path 기준 상대 경로이며, base path 밖을 가리키는 경로는 거부합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class JsonFileConfigSource implements ConfigSource {

    private static final Logger log = LoggerFactory.getLogger(JsonFileConfigSource.class);

    private final Path templatesFile;
    private final Path basePath;
    private final ObjectMapper mapper;

    public JsonFileConfigSource(Path templatesFile, Path basePath, ObjectMapper mapper) {
        if (templatesFile == null) {
            throw new IllegalArgumentException("templatesFile cannot be null");
        }
        if (basePath == null) {
            throw new IllegalArgumentException("basePath cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.templatesFile = templatesFile;
        this.basePath = basePath.toAbsolutePath().normalize();
        this.mapper = mapper;
    }

    public static JsonFileConfigSource of(Path templatesFile, ResolverConfig config, ObjectMapper mapper) {
        return new JsonFileConfigSource(templatesFile, config.basePath(), mapper);
    }

    @Override
    public Optional<Template> loadTemplate(TemplateId templateId) {
        if (templateId == null) {
            throw new IllegalArgumentException("templateId cannot be null");
        }
        return loadTemplates().stream()
            .filter(t -> t.templateId().equals(templateId))
            .findFirst();
    }

    /**
     * @throws TemplateConfigurationException 파일을 읽을 수 없거나 항목이 잘못되었거나 ID가 중복된 경우
     */
    @Override
    public List<Template> loadTemplates() {
        TemplatesFile document;
        try {
            document = mapper.readValue(templatesFile.toFile(), TemplatesFile.class);
        } catch (IOException e) {
            throw new TemplateConfigurationException("Failed to read templates from " + templatesFile, e);
        }
        List<Template> templates = new ArrayList<>();
        Set<TemplateId> seen = new HashSet<>();
        if (document.templates() != null) {
            for (TemplateDocument entry : document.templates()) {
                Template template = entry.toTemplate();
                if (!seen.add(template.templateId())) {
                    throw new TemplateConfigurationException(
                        "Duplicate templateId " + template.templateId() + " in " + templatesFile);
                }
                templates.add(template);
            }
        }
        log.debug("Loaded {} templates from {}", templates.size(), templatesFile);
        return templates;
    }

    @Override
    public String loadRawSpec(String path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        Path resolved = basePath.resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new SpecFileNotFoundException("Spec file " + path + " is outside base path " + basePath);
        }
        try {
            return Files.readString(resolved, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new SpecFileNotFoundException("Spec file not found: " + resolved, e);
        } catch (IOException e) {
            throw new SpecFileNotFoundException("Spec file could not be read: " + resolved, e);
        }
    }

    /**
     * templates.json의 마지막 수정 시각.
     *
     * @return 수정 시각 (파일이 없으면 empty)
     */
    public Optional<FileTime> lastModified() {
        try {
            return Optional.of(Files.getLastModifiedTime(templatesFile));
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TemplatesFile(List<TemplateDocument> templates) {
    }
}
