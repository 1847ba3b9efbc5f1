package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.model.Template;
import com.ryuqq.provisioner.core.model.TemplateId;

import java.util.List;
import java.util.Optional;

/**
 * 템플릿 설정 저장소 SPI.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface ConfigSource {

    /**
     * 템플릿 조회.
     *
     * @param templateId 템플릿 ID
     * @return 템플릿 (없으면 empty)
     */
    Optional<Template> loadTemplate(TemplateId templateId);

    /**
     * 전체 템플릿 목록 (선언 순서 유지).
     *
     * @return 템플릿 목록
     */
    List<Template> loadTemplates();

    /**
     * base path 기준 상대 경로의 raw 스펙 파일 읽기.
     *
     * @param path 상대 경로
     * @return 파일 내용
     * @throws com.ryuqq.provisioner.core.exception.SpecFileNotFoundException 파일이 없는 경우
     */
    String loadRawSpec(String path);
}
