/**
 * 전제조건 평가 패키지.
 *
 * <p>Task가 실행되기 전에 평가되는 전제조건과, 그 결과를 하나의 준비 판정으로 축약하는 평가기를 제공합니다.</p>
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.procedure.core.condition.Precondition} - 콜백 방식 전제조건 (최대 1회 평가)</li>
 *   <li>{@link com.ryuqq.procedure.core.condition.ConditionResult} - Satisfied / Ignored / Failed</li>
 *   <li>{@link com.ryuqq.procedure.core.condition.PreconditionEvaluator} - 생성 의존성 제출, 평가, 축약</li>
 * </ul>
 *
 * <h2>축약 규칙</h2>
 * <ul>
 *   <li>Failed가 하나라도 있으면 모든 실패 오류로 소유 Task를 취소</li>
 *   <li>Ignored는 진행을 막지 않음</li>
 *   <li>전제조건이 없으면 즉시 준비 완료</li>
 * </ul>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
package com.ryuqq.procedure.core.condition;
