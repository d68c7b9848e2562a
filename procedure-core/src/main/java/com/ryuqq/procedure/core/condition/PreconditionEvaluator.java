package com.ryuqq.procedure.core.condition;

import com.ryuqq.procedure.core.model.TaskError;
import com.ryuqq.procedure.core.spi.TaskQueue;
import com.ryuqq.procedure.core.task.Task;
import com.ryuqq.procedure.core.task.TaskReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * 전제조건 평가기.
 *
 * <p>Task가 실행되기 전에 연결된 모든 전제조건을 평가하고, 결과를 하나의 판정으로 축약합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <ol>
 *   <li>전제조건마다 생성 의존성을 큐에 제출 (이미 제출된 Task는 건너뜀)</li>
 *   <li>생성 의존성이 모두 종료되면 전제조건 평가 (블로킹 없이 future 조합으로 대기)</li>
 *   <li>전제조건끼리는 순서 없이 동시에 평가될 수 있음</li>
 *   <li>모든 결과를 축약: Failed 오류 수집, Satisfied/Ignored 개수 집계</li>
 * </ol>
 *
 * <p><strong>취소:</strong> 소유 Task가 취소되면 남은 평가를 기다리지 않고 즉시
 * {@link EvaluationSummary#abandon()}로 완료합니다. 진행 중이던 전제조건 콜백은 나중에 도착해도
 * {@link TaskReference}로 Task의 종료를 감지하고 조용히 끝납니다.</p>
 *
 * <p><strong>비소유 참조:</strong> 평가기가 등록하는 모든 콜백은 Task가 아닌
 * {@link TaskReference}만 캡처합니다.</p>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public final class PreconditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PreconditionEvaluator.class);

    /**
     * 전제조건 평가.
     *
     * @param owner 소유 Task의 비소유 참조
     * @param preconditions 평가할 전제조건 (등록 순)
     * @param queue 생성 의존성을 제출할 큐
     * @param cancellation 소유 Task의 취소 신호
     * @return 평가 요약 (예외로 완료되지 않음)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CompletableFuture<EvaluationSummary> evaluate(
        TaskReference owner,
        List<Precondition> preconditions,
        TaskQueue queue,
        CompletionStage<Void> cancellation
    ) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        if (preconditions == null) {
            throw new IllegalArgumentException("preconditions cannot be null");
        }
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (cancellation == null) {
            throw new IllegalArgumentException("cancellation cannot be null");
        }

        if (preconditions.isEmpty()) {
            return CompletableFuture.completedFuture(EvaluationSummary.empty());
        }

        CompletableFuture<Void> cancelled = cancellation.toCompletableFuture();
        if (cancelled.isDone()) {
            log.debug("Task {} cancelled before evaluating {} preconditions",
                owner.getTaskId().shortValue(), preconditions.size());
            return CompletableFuture.completedFuture(EvaluationSummary.abandon());
        }

        List<CompletableFuture<ConditionResult>> results = new ArrayList<>(preconditions.size());
        for (Precondition precondition : preconditions) {
            results.add(evaluateOne(owner, precondition, queue));
        }

        CompletableFuture<EvaluationSummary> reduced = CompletableFuture
            .allOf(results.toArray(new CompletableFuture<?>[0]))
            .thenApply(ignored -> reduce(results));

        return reduced.applyToEither(
            cancelled.thenApply(ignored -> EvaluationSummary.abandon()),
            Function.identity()
        );
    }

    private CompletableFuture<ConditionResult> evaluateOne(TaskReference owner, Precondition precondition, TaskQueue queue) {
        Set<Task> produced = precondition.getProducedDependencies();
        CompletableFuture<?>[] waits = new CompletableFuture<?>[produced.size()];
        int i = 0;
        for (Task dependency : produced) {
            if (queue.offer(dependency)) {
                log.trace("Produced dependency {} of {} submitted", dependency.getName(), precondition.getName());
            }
            waits[i++] = dependency.whenFinished().toCompletableFuture();
        }

        return CompletableFuture.allOf(waits)
            .thenCompose(ignored -> {
                if (!owner.isAlive()) {
                    log.debug("Task {} finished before {} was evaluated",
                        owner.getTaskId().shortValue(), precondition.getName());
                    return CompletableFuture.completedFuture(ConditionResult.ignored());
                }
                return precondition.evaluate(owner);
            })
            .exceptionally(error -> ConditionResult.failed(TaskError.fromException(unwrap(error))));
    }

    private EvaluationSummary reduce(List<CompletableFuture<ConditionResult>> results) {
        int satisfied = 0;
        int ignored = 0;
        List<TaskError> failures = new ArrayList<>();
        for (CompletableFuture<ConditionResult> future : results) {
            ConditionResult result = future.join();
            if (result instanceof ConditionResult.Failed failed) {
                failures.add(failed.error());
            } else if (result.isSatisfied()) {
                satisfied++;
            } else {
                ignored++;
            }
        }
        return new EvaluationSummary(satisfied, ignored, failures, false);
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
