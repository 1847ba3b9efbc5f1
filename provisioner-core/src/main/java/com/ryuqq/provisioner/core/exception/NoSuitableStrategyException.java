package com.ryuqq.provisioner.core.exception;

/**
 * 선택 조건을 만족하는 전략이 없음.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class NoSuitableStrategyException extends ProvisioningException {

    private final String unmetCriterion;

    public NoSuitableStrategyException(String unmetCriterion, String message) {
        super(ErrorKind.NO_SUITABLE_STRATEGY, message);
        this.unmetCriterion = unmetCriterion;
    }

    /**
     * 마지막 후보를 탈락시킨 조건 이름 (예: capabilities, healthy, exclusion).
     *
     * @return 조건 이름
     */
    public String getUnmetCriterion() {
        return unmetCriterion;
    }
}
