package com.ryuqq.apimanager.core.statemachine;

/**
 * 요청 처리 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CHECK_RESYNC → CHECK_CACHE</li>
 *   <li>CHECK_CACHE → CHECK_QUOTA (미스), RETURN (적중)</li>
 *   <li>CHECK_QUOTA → CALL</li>
 *   <li>CALL → UPDATE</li>
 *   <li>UPDATE → RETURN</li>
 *   <li>비종료 상태 → FAILED</li>
 * </ul>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RequestState from, RequestState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = to == RequestState.FAILED || switch (from) {
            case CHECK_RESYNC -> to == RequestState.CHECK_CACHE;
            case CHECK_CACHE -> to == RequestState.CHECK_QUOTA || to == RequestState.RETURN;
            case CHECK_QUOTA -> to == RequestState.CALL;
            case CALL -> to == RequestState.UPDATE;
            case UPDATE -> to == RequestState.RETURN;
            case RETURN, FAILED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static RequestState transition(RequestState current, RequestState next) {
        validate(current, next);
        return next;
    }
}
