package com.ryuqq.procedure.core.condition;

import com.ryuqq.procedure.core.model.TaskError;

/**
 * 전제조건 평가 결과.
 *
 * <p>ConditionResult는 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Satisfied}: 전제조건 충족</li>
 *   <li>{@link Ignored}: 판정 보류, 진행을 막지 않음</li>
 *   <li>{@link Failed}: 전제조건 실패, 소유 Task를 오류와 함께 취소</li>
 * </ul>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public sealed interface ConditionResult permits ConditionResult.Satisfied, ConditionResult.Ignored, ConditionResult.Failed {

    static ConditionResult satisfied() {
        return Satisfied.INSTANCE;
    }

    static ConditionResult ignored() {
        return Ignored.INSTANCE;
    }

    /**
     * 실패 결과 생성.
     *
     * @param error 실패 오류
     * @return Failed 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    static ConditionResult failed(TaskError error) {
        return new Failed(error);
    }

    default boolean isSatisfied() {
        return this instanceof Satisfied;
    }

    default boolean isIgnored() {
        return this instanceof Ignored;
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }

    /**
     * 전제조건 충족.
     */
    record Satisfied() implements ConditionResult {
        private static final Satisfied INSTANCE = new Satisfied();
    }

    /**
     * 판정 보류.
     */
    record Ignored() implements ConditionResult {
        private static final Ignored INSTANCE = new Ignored();
    }

    /**
     * 전제조건 실패.
     *
     * @param error 실패 오류
     */
    record Failed(TaskError error) implements ConditionResult {

        public Failed {
            if (error == null) {
                throw new IllegalArgumentException("error cannot be null");
            }
        }
    }
}
