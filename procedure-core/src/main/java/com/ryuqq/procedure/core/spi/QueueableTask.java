package com.ryuqq.procedure.core.spi;

import com.ryuqq.procedure.core.model.TaskError;
import com.ryuqq.procedure.core.model.TaskId;
import com.ryuqq.procedure.core.statemachine.TaskState;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionStage;

/**
 * Task가 외부 작업 큐에 노출하는 좁은 계약.
 *
 * <p>큐는 스레드 배정과 실행 순서 정책을 소유하고, Task는 어떤 스레드에서 호출되든
 * 자신의 상태 전이가 단 하나의 유효한 경로를 따르도록 보장합니다.
 * 큐는 아래 메서드를 통해서만 Task를 진행시키며 상태를 직접 바꾸지 않습니다.</p>
 *
 * <p><strong>큐의 호출 순서:</strong></p>
 * <pre>
 * 1. enqueue(queue)                 INITIALIZED → PENDING
 * 2. 의존성의 whenFinished() 또는 whenCancelled() 대기 (블로킹 없이)
 * 3. evaluatePreconditions()        PENDING → EVALUATING_PRECONDITIONS → READY
 * 4. start()                        READY → EXECUTING (취소된 경우 곧바로 종료 처리)
 * 5. whenFinished() 완료 시 Task에 대한 보유 해제
 * </pre>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public interface QueueableTask {

    TaskId getId();

    String getName();

    TaskState getState();

    /**
     * 준비 여부.
     *
     * @return 의존성이 끝나고 전제조건 판정이 완료되어 READY 상태이면 true
     */
    boolean isReady();

    boolean isCancelled();

    boolean isFinished();

    /**
     * 의존성 집합 (읽기 전용).
     *
     * @return 이 Task보다 먼저 종료되어야 하는 Task들
     */
    Set<? extends QueueableTask> getDependencies();

    /**
     * 종료 알림. FINISHED에서 정확히 한 번, 동결된 오류 목록으로 완료됩니다.
     *
     * @return 종료 시 완료되는 stage
     */
    CompletionStage<List<TaskError>> whenFinished();

    /**
     * 최초 취소 시 완료되는 신호.
     *
     * @return 취소 신호
     */
    CompletionStage<Void> whenCancelled();

    /**
     * 큐에 제출됨을 기록 (INITIALIZED → PENDING).
     *
     * @param queue 제출된 큐
     * @return 이번 호출로 제출되었으면 true, 이미 제출되었거나 종료되었으면 false
     * @throws IllegalArgumentException queue가 null인 경우
     */
    boolean enqueue(TaskQueue queue);

    /**
     * 전제조건 평가. 반환된 stage는 예외 없이 완료되며, 완료 시점에 Task는 READY이거나 종료 처리 중입니다.
     *
     * @return 평가 완료 stage
     */
    CompletionStage<Void> evaluatePreconditions();

    /**
     * 실행 시작 요청. 실행 본문은 Task의 직렬 이벤트 큐에서 실행됩니다.
     */
    void start();

    /**
     * 종료 요청 (동시 호출 시 하나만 적용).
     *
     * @param errors 추가할 오류
     */
    void finish(List<TaskError> errors);
}
