package com.ryuqq.provisioner.core.statemachine;

import com.ryuqq.provisioner.core.exception.InvalidRequestStateException;
import com.ryuqq.provisioner.core.model.RequestStatus;

/**
 * Request 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING (dispatch 성공)</li>
 *   <li>PENDING → FAILED (해석 실패, 백엔드 실패, 취소)</li>
 *   <li>RUNNING → COMPLETED | COMPLETED_WITH_ERROR | FAILED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태에서는 어떤 상태로도 전이 불가 (종료된 Request는 불변)</li>
 *   <li>역방향 전이 불가 (예: RUNNING → PENDING)</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class RequestStateTransition {

    private RequestStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws InvalidRequestStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RequestStatus from, RequestStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new InvalidRequestStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to));
        }

        boolean valid = switch (from) {
            case PENDING -> to == RequestStatus.RUNNING || to == RequestStatus.FAILED;
            case RUNNING -> to.isTerminal();
            case COMPLETED, COMPLETED_WITH_ERROR, FAILED -> false;
        };

        if (!valid) {
            throw new InvalidRequestStateException(
                String.format("Invalid state transition: %s → %s", from, to));
        }
    }

    /**
     * 전이 가능 여부 확인 (예외 없이).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 유효한 전이이면 true
     */
    public static boolean canTransition(RequestStatus from, RequestStatus to) {
        try {
            validate(from, to);
            return true;
        } catch (InvalidRequestStateException e) {
            return false;
        }
    }
}
