package com.ryuqq.provisioner.adapter.runner.resilience;

import com.ryuqq.provisioner.core.exception.ErrorKind;
import com.ryuqq.provisioner.core.exception.ProvisioningException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

/**
 * 백엔드 호출 실패를 일시적/영구적으로 분류.
 *
 * <p><strong>일시적 (재시도 대상, Circuit Breaker 실패로 집계):</strong></p>
 * <ul>
 *   <li>{@link ErrorKind#TRANSIENT_BACKEND} 또는 {@link ErrorKind#TIMEOUT} 종류의 {@link ProvisioningException}</li>
 *   <li>{@link TimeoutException}, {@link IOException}, {@link UncheckedIOException} (cause 체인 포함)</li>
 * </ul>
 *
 * <p>그 외 모든 실패 (인증, 파라미터 오류, 할당량 초과 등)는 영구 오류입니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class FailureClassifier {

    /**
     * 재시도 가능한 실패인지 판단.
     *
     * @param failure 백엔드 호출 중 발생한 예외
     * @return 일시적 오류이면 true
     */
    public boolean isTransient(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof ProvisioningException) {
                ErrorKind kind = ((ProvisioningException) current).getKind();
                return kind == ErrorKind.TRANSIENT_BACKEND || kind == ErrorKind.TIMEOUT;
            }
            if (current instanceof TimeoutException
                || current instanceof IOException
                || current instanceof UncheckedIOException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
