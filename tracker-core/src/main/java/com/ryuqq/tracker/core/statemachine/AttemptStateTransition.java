package com.ryuqq.tracker.core.statemachine;

/**
 * 시도 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → EXTRACTING, PENDING → FAILED (사전 조건 실패)</li>
 *   <li>EXTRACTING → ANALYZING, EXTRACTING → FAILED</li>
 *   <li>ANALYZING → PARSING, ANALYZING → FAILED</li>
 *   <li>PARSING → SUCCEEDED, PARSING → FAILED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태(SUCCEEDED, FAILED)에서는 어떤 상태로도 전이 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AttemptStateTransition {

    // Utility class - prevent instantiation
    private AttemptStateTransition() {
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
    public static void validate(AttemptState from, AttemptState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == AttemptState.EXTRACTING || to == AttemptState.FAILED;
            case EXTRACTING -> to == AttemptState.ANALYZING || to == AttemptState.FAILED;
            case ANALYZING -> to == AttemptState.PARSING || to == AttemptState.FAILED;
            case PARSING -> to == AttemptState.SUCCEEDED || to == AttemptState.FAILED;
            case SUCCEEDED, FAILED -> false;
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
    public static AttemptState transition(AttemptState current, AttemptState next) {
        validate(current, next);
        return next;
    }
}
