package com.ryuqq.provisioner.adapter.template.resolver;

import java.nio.file.Path;

/**
 * 템플릿 해석기 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>basePath: 파일 스펙 상대 경로의 기준 디렉토리 (기본 현재 디렉토리)</li>
 *   <li>renderTimeoutMs: 스펙 하나의 렌더링 시간 예산 (기본 2000ms)</li>
 *   <li>packageName / packageVersion: 렌더링 변수 package_name, package_version 값</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param basePath 파일 스펙 기준 디렉토리 (null이 아니어야 함)
 * @param renderTimeoutMs 렌더링 시간 예산 (밀리초, 양수여야 함)
 * @param packageName 패키지 이름 (null이 아니어야 함)
 * @param packageVersion 패키지 버전 (null이 아니어야 함)
 */
public record ResolverConfig(
    Path basePath,
    long renderTimeoutMs,
    String packageName,
    String packageVersion
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: basePath=".", renderTimeoutMs=2000ms, packageName="provisioner", packageVersion="1.0.0"</p>
     */
    public ResolverConfig() {
        this(Path.of("."), 2000, "provisioner", "1.0.0");
    }

    public ResolverConfig {
        if (basePath == null) {
            throw new IllegalArgumentException("basePath cannot be null");
        }
        if (renderTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "renderTimeoutMs must be positive (current: " + renderTimeoutMs + ")"
            );
        }
        if (packageName == null) {
            throw new IllegalArgumentException("packageName cannot be null");
        }
        if (packageVersion == null) {
            throw new IllegalArgumentException("packageVersion cannot be null");
        }
    }

    public ResolverConfig withBasePath(Path basePath) {
        return new ResolverConfig(basePath, renderTimeoutMs, packageName, packageVersion);
    }

    public ResolverConfig withRenderTimeoutMs(long renderTimeoutMs) {
        return new ResolverConfig(basePath, renderTimeoutMs, packageName, packageVersion);
    }

    public ResolverConfig withPackage(String packageName, String packageVersion) {
        return new ResolverConfig(basePath, renderTimeoutMs, packageName, packageVersion);
    }
}
