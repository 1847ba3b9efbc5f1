package com.ryuqq.provisioner.core.model;

/**
 * 요청 유형.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum RequestType {

    /** 신규 머신 프로비저닝. */
    PROVISION("req-"),

    /** 기존 머신 반환(종료). */
    RETURN("ret-");

    private final String idPrefix;

    RequestType(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String getIdPrefix() {
        return idPrefix;
    }
}
