package com.ryuqq.procedure.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>Task의 상태 전이가 허용된 규칙을 따르는지 검증합니다.
 * Task는 compare-and-set 직전에 이 검증을 수행하므로, 잘못된 전이는 상태를 바꾸기 전에 거부됩니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>INITIALIZED → PENDING</li>
 *   <li>PENDING → EVALUATING_PRECONDITIONS</li>
 *   <li>EVALUATING_PRECONDITIONS → READY</li>
 *   <li>READY → EXECUTING</li>
 *   <li>FINISHING 이전의 모든 상태 → FINISHING</li>
 *   <li>FINISHING → FINISHED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>FINISHED에서는 어떤 상태로도 전이 불가</li>
 *   <li>역방향 전이 불가 (예: EXECUTING → READY)</li>
 *   <li>FINISHING → FINISHING 순환 불가</li>
 * </ul>
 *
 * @author Procedure Team
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
    public static void validate(TaskState from, TaskState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        // FINISHING은 종료 처리 전의 모든 상태에서 진입 가능
        boolean valid = switch (from) {
            case INITIALIZED -> to == TaskState.PENDING || to == TaskState.FINISHING;
            case PENDING -> to == TaskState.EVALUATING_PRECONDITIONS || to == TaskState.FINISHING;
            case EVALUATING_PRECONDITIONS -> to == TaskState.READY || to == TaskState.FINISHING;
            case READY -> to == TaskState.EXECUTING || to == TaskState.FINISHING;
            case EXECUTING -> to == TaskState.FINISHING;
            case FINISHING -> to == TaskState.FINISHED;
            case FINISHED -> false;
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
    public static TaskState transition(TaskState current, TaskState next) {
        validate(current, next);
        return next;
    }
}
