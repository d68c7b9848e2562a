package com.ryuqq.procedure.core.condition;

import com.ryuqq.procedure.core.model.TaskError;
import com.ryuqq.procedure.core.spi.QueueableTask;
import com.ryuqq.procedure.core.spi.TaskQueue;
import com.ryuqq.procedure.core.task.BlockTask;
import com.ryuqq.procedure.core.task.Task;
import com.ryuqq.procedure.core.task.TaskReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * PreconditionEvaluator 테스트.
 *
 * <ul>
 *   <li>결과 집계 (satisfied / ignored / failed)</li>
 *   <li>생성 의존성 제출 및 종료 대기</li>
 *   <li>취소 신호 시 abandoned</li>
 *   <li>종료된 소유자의 전제조건은 평가하지 않음</li>
 * </ul>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class PreconditionEvaluatorTest {

    @Mock
    private TaskQueue queue;

    private PreconditionEvaluator evaluator;
    private Task owner;
    private CompletableFuture<Void> cancellation;

    @BeforeEach
    void setUp() {
        evaluator = new PreconditionEvaluator();
        owner = new BlockTask("owner", () -> { });
        cancellation = new CompletableFuture<>();
    }

    @Test
    void 전제조건이_없으면_즉시_빈_요약을_반환한다() {
        // when
        EvaluationSummary summary = evaluator.evaluate(owner.reference(), List.of(), queue, cancellation).join();

        // then
        assertThat(summary).isEqualTo(EvaluationSummary.empty());
        verifyNoInteractions(queue);
    }

    @Test
    void 결과를_집계하고_실패_오류를_모두_모은다() {
        // given
        TaskError first = TaskError.of("E-1", "first failure");
        TaskError second = TaskError.of("E-2", "second failure");
        List<Precondition> preconditions = List.of(
            fixed(ConditionResult.satisfied()),
            fixed(ConditionResult.failed(first)),
            fixed(ConditionResult.ignored()),
            fixed(ConditionResult.failed(second)),
            fixed(ConditionResult.satisfied())
        );

        // when
        EvaluationSummary summary = evaluator.evaluate(owner.reference(), preconditions, queue, cancellation).join();

        // then
        assertThat(summary.satisfied()).isEqualTo(2);
        assertThat(summary.ignored()).isEqualTo(1);
        assertThat(summary.failures()).containsExactly(first, second);
        assertThat(summary.abandoned()).isFalse();
        assertThat(summary.hasFailures()).isTrue();
    }

    @Test
    void 생성_의존성을_큐에_제출하고_종료된_뒤에_평가한다() {
        // given
        Task dependency = new BlockTask("produced", () -> { });
        Precondition precondition = fixed(ConditionResult.satisfied());
        precondition.addProducedDependency(dependency);
        when(queue.offer(any(QueueableTask.class))).thenReturn(true);

        // when
        CompletableFuture<EvaluationSummary> summary =
            evaluator.evaluate(owner.reference(), List.of(precondition), queue, cancellation);

        // then: 의존성이 끝나기 전에는 평가하지 않음
        verify(queue).offer(dependency);
        assertThat(summary).isNotDone();
        assertThat(precondition.evaluationCount()).isZero();

        // when
        dependency.finish();

        // then
        assertThat(summary).isCompleted();
        assertThat(summary.join().satisfied()).isEqualTo(1);
        assertThat(precondition.evaluationCount()).isEqualTo(1);
    }

    @Test
    void 큐가_생성_의존성을_즉시_실행해도_평가가_진행된다() {
        // given
        Precondition precondition = fixed(ConditionResult.satisfied());
        precondition.addProducedDependency(new BlockTask(() -> { }));
        precondition.addProducedDependency(new BlockTask(() -> { }));
        doAnswer(invocation -> {
            QueueableTask task = invocation.getArgument(0);
            task.finish(List.of());
            return true;
        }).when(queue).offer(any(QueueableTask.class));

        // when
        EvaluationSummary summary =
            evaluator.evaluate(owner.reference(), List.of(precondition), queue, cancellation).join();

        // then
        verify(queue, times(2)).offer(any(QueueableTask.class));
        assertThat(summary.satisfied()).isEqualTo(1);
    }

    @Test
    void 취소되면_대기중인_평가를_포기한다() {
        // given
        Precondition neverCompletes = new Precondition("never") {
            @Override
            protected void evaluate(TaskReference reference, Consumer<ConditionResult> completion) {
            }
        };
        CompletableFuture<EvaluationSummary> summary =
            evaluator.evaluate(owner.reference(), List.of(neverCompletes), queue, cancellation);
        assertThat(summary).isNotDone();

        // when
        cancellation.complete(null);

        // then
        assertThat(summary.join()).isEqualTo(EvaluationSummary.abandon());
    }

    @Test
    void 이미_취소된_경우_전제조건을_평가하지_않는다() {
        // given
        Precondition precondition = fixed(ConditionResult.satisfied());
        cancellation.complete(null);

        // when
        EvaluationSummary summary =
            evaluator.evaluate(owner.reference(), List.of(precondition), queue, cancellation).join();

        // then
        assertThat(summary.abandoned()).isTrue();
        assertThat(precondition.evaluationCount()).isZero();
    }

    @Test
    void 종료된_소유자의_전제조건은_Ignored로_처리된다() {
        // given
        Precondition precondition = fixed(ConditionResult.failed(TaskError.of("E-1", "should not be evaluated")));
        owner.finish();

        // when
        EvaluationSummary summary =
            evaluator.evaluate(owner.reference(), List.of(precondition), queue, cancellation).join();

        // then
        assertThat(summary.ignored()).isEqualTo(1);
        assertThat(summary.hasFailures()).isFalse();
        assertThat(precondition.evaluationCount()).isZero();
    }

    @Test
    void null_인자는_거부된다() {
        assertThatThrownBy(() -> evaluator.evaluate(null, List.of(), queue, cancellation))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> evaluator.evaluate(owner.reference(), null, queue, cancellation))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> evaluator.evaluate(owner.reference(), List.of(), null, cancellation))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> evaluator.evaluate(owner.reference(), List.of(), queue, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static Precondition fixed(ConditionResult result) {
        return new Precondition() {
            @Override
            protected void evaluate(TaskReference reference, Consumer<ConditionResult> completion) {
                completion.accept(result);
            }
        };
    }
}
