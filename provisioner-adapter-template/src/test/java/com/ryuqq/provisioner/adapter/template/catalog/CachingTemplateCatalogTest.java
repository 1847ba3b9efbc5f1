package com.ryuqq.provisioner.adapter.template.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.provisioner.core.model.TemplateId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CachingTemplateCatalogTest {

    @TempDir
    Path dir;

    private Path write(String templateId, int maxNumber, Instant modified) throws Exception {
        Path file = dir.resolve("templates.json");
        Files.writeString(file, "{\"templates\":[{\"templateId\":\"" + templateId
            + "\",\"backendType\":\"RunInstances\",\"imageId\":\"ami-1\",\"maxNumber\":" + maxNumber + "}]}");
        Files.setLastModifiedTime(file, FileTime.from(modified));
        return file;
    }

    @Test
    void 파일이_바뀌지_않으면_캐시를_사용한다() throws Exception {
        // given
        Instant t0 = Instant.parse("2024-01-01T00:00:00Z");
        Path file = write("tpl-a", 5, t0);
        CachingTemplateCatalog catalog = new CachingTemplateCatalog(
            new JsonFileConfigSource(file, dir, new ObjectMapper()));
        catalog.loadTemplates();

        // when: 내용은 바꾸되 수정 시각은 유지
        write("tpl-b", 5, t0);

        // then
        assertThat(catalog.loadTemplate(TemplateId.of("tpl-a"))).isPresent();
        assertThat(catalog.loadTemplate(TemplateId.of("tpl-b"))).isEmpty();
    }

    @Test
    void 수정_시각이_바뀌면_다시_로드한다() throws Exception {
        // given
        Instant t0 = Instant.parse("2024-01-01T00:00:00Z");
        Path file = write("tpl-a", 5, t0);
        CachingTemplateCatalog catalog = new CachingTemplateCatalog(
            new JsonFileConfigSource(file, dir, new ObjectMapper()));
        catalog.loadTemplates();

        // when
        write("tpl-a", 9, t0.plusSeconds(60));

        // then
        assertThat(catalog.loadTemplate(TemplateId.of("tpl-a")).orElseThrow().maxNumber()).isEqualTo(9);
    }

    @Test
    void refresh_호출_후에는_다시_로드한다() throws Exception {
        // given
        Instant t0 = Instant.parse("2024-01-01T00:00:00Z");
        Path file = write("tpl-a", 5, t0);
        CachingTemplateCatalog catalog = new CachingTemplateCatalog(
            new JsonFileConfigSource(file, dir, new ObjectMapper()));
        catalog.loadTemplates();
        write("tpl-b", 5, t0);

        // when
        catalog.refresh();

        // then
        assertThat(catalog.loadTemplates()).extracting(t -> t.templateId().getValue()).containsExactly("tpl-b");
    }
}
