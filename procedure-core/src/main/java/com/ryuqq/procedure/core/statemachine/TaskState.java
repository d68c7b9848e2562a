package com.ryuqq.procedure.core.statemachine;

/**
 * Task의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * INITIALIZED
 *    │  (큐에 제출)
 *    ▼
 * PENDING ─────────────┐
 *    │  (의존성 완료)    │
 *    ▼                 │
 * EVALUATING_PRECONDITIONS ─┤
 *    │  (전제조건 판정)   │
 *    ▼                 │  finish()
 * READY ───────────────┤  (어느 상태에서든 한 번만)
 *    │  (실행 시작)      │
 *    ▼                 │
 * EXECUTING ───────────┤
 *                      ▼
 *                 FINISHING
 *                      │  (will-finish 관찰자 완료, 오류 목록 동결)
 *                      ▼
 *                  FINISHED
 * </pre>
 *
 * <p>취소 플래그는 상태와 독립적이며 FINISHED 이전 어느 상태에서든 설정할 수 있습니다.</p>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public enum TaskState {

    /**
     * 생성됨 (아직 큐에 제출되지 않음).
     */
    INITIALIZED,

    /**
     * 큐에 제출됨, 의존성 대기 중.
     */
    PENDING,

    /**
     * 전제조건 평가 중.
     */
    EVALUATING_PRECONDITIONS,

    /**
     * 실행 가능.
     */
    READY,

    /**
     * 실행 중.
     */
    EXECUTING,

    /**
     * 종료 처리 중 (finish 호출이 선점됨).
     */
    FINISHING,

    /**
     * 종료됨 (오류 목록 불변).
     */
    FINISHED;

    /**
     * finish가 이미 선점되었는지 확인.
     *
     * @return FINISHING 또는 FINISHED인 경우 true
     */
    public boolean isFinishing() {
        return this == FINISHING || this == FINISHED;
    }

    /**
     * 종료 상태인지 확인.
     *
     * @return FINISHED인 경우 true
     */
    public boolean isTerminal() {
        return this == FINISHED;
    }

    /**
     * 생명주기 순서상 다른 상태보다 앞서는지 확인.
     *
     * @param other 비교 대상 상태
     * @return 이 상태가 other보다 앞서면 true
     */
    public boolean isBefore(TaskState other) {
        return ordinal() < other.ordinal();
    }
}
