package com.ryuqq.procedure.core.condition;

import com.ryuqq.procedure.core.model.TaskError;

import java.util.List;

/**
 * Task 하나의 전제조건 평가 결과 요약.
 *
 * @param satisfied 충족된 전제조건 수
 * @param ignored 보류된 전제조건 수
 * @param failures 실패한 전제조건의 오류 (등록 순)
 * @param abandoned 소유 Task가 취소되어 평가 대기를 중단했는지 여부
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public record EvaluationSummary(
    int satisfied,
    int ignored,
    List<TaskError> failures,
    boolean abandoned
) {

    private static final EvaluationSummary EMPTY = new EvaluationSummary(0, 0, List.of(), false);
    private static final EvaluationSummary ABANDONED = new EvaluationSummary(0, 0, List.of(), true);

    public EvaluationSummary {
        if (satisfied < 0 || ignored < 0) {
            throw new IllegalArgumentException("counts cannot be negative (satisfied: " + satisfied + ", ignored: " + ignored + ")");
        }
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    /**
     * 전제조건이 없는 Task의 요약.
     */
    public static EvaluationSummary empty() {
        return EMPTY;
    }

    public static EvaluationSummary abandon() {
        return ABANDONED;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
