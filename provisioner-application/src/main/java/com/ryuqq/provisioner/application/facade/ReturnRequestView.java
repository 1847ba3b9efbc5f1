package com.ryuqq.provisioner.application.facade;

/**
 * 반환 진행 중인 머신.
 *
 * @param machine 머신 이름
 * @param gracePeriod 유예 시간 (초)
 */
public record ReturnRequestView(String machine, long gracePeriod) {
}
