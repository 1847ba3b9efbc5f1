package com.ryuqq.provisioner.core.model;

/**
 * 가격 유형.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum PriceType {

    ONDEMAND,
    SPOT,
    HETEROGENEOUS
}
