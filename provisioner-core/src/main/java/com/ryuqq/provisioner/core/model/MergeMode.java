package com.ryuqq.provisioner.core.model;

/**
 * 기본 속성과 raw 스펙의 병합 방식.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum MergeMode {

    /** 기본 속성 위에 raw 스펙을 깊은 병합. */
    MERGE,

    /** 기본 속성을 버리고 raw 스펙만 사용. */
    REPLACE
}
