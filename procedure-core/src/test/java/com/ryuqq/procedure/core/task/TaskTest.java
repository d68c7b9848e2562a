package com.ryuqq.procedure.core.task;

import com.ryuqq.procedure.core.condition.BlockCondition;
import com.ryuqq.procedure.core.condition.ConditionResult;
import com.ryuqq.procedure.core.condition.Precondition;
import com.ryuqq.procedure.core.model.TaskError;
import com.ryuqq.procedure.core.observer.LifecycleEvent;
import com.ryuqq.procedure.core.statemachine.TaskState;
import com.ryuqq.procedure.core.support.DirectTaskQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Task 상태 기계 테스트.
 *
 * <ul>
 *   <li>생명주기 순서 (will-execute → execute → did-execute → will-finish → did-finish)</li>
 *   <li>동시 finish 호출 시 정확히 한 번의 종료</li>
 *   <li>협력적 취소 및 오류 전달</li>
 *   <li>늦은 cancel/finish 처리 규칙</li>
 *   <li>제출 이후 구성 변경 거부</li>
 * </ul>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
class TaskTest {

    private DirectTaskQueue queue;
    private List<String> events;

    @BeforeEach
    void setUp() {
        queue = new DirectTaskQueue();
        events = Collections.synchronizedList(new ArrayList<>());
    }

    // ========== 생명주기 ==========

    @Test
    void 정상_흐름은_정해진_순서로_이벤트를_발생시킨다() {
        // given
        BlockTask task = new BlockTask("ordered", () -> events.add("execute"));
        recordAllEvents(task);
        task.addCompletionBlock(() -> events.add("completion"));

        // when
        queue.submit(task);

        // then
        assertThat(task.getState()).isEqualTo(TaskState.FINISHED);
        assertThat(events).containsExactly(
            "will-execute", "execute", "did-execute", "will-finish", "did-finish", "completion");
        assertThat(task.whenFinished().toCompletableFuture().join()).isEmpty();
        assertThat(task.isCancelled()).isFalse();
    }

    @Test
    void 실행_본문의_예외는_오류와_함께_종료시킨다() {
        // given
        BlockTask task = new BlockTask("throwing", () -> {
            throw new IllegalStateException("disk unavailable");
        });
        recordAllEvents(task);

        // when
        queue.submit(task);

        // then
        assertThat(task.isFinished()).isTrue();
        assertThat(task.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.code()).isEqualTo(TaskError.EXECUTION_FAILED);
            assertThat(error.message()).isEqualTo("disk unavailable");
        });
        assertThat(events).containsExactly("will-execute", "did-execute", "will-finish", "did-finish");
    }

    @Test
    void 의존성이_종료된_뒤에_실행된다() {
        // given
        BlockTask first = new BlockTask("first", () -> events.add("first"));
        BlockTask second = new BlockTask("second", () -> events.add("second"));
        second.addDependency(first);

        // when
        queue.submit(second);

        // then
        assertThat(second.getState()).isEqualTo(TaskState.PENDING);
        assertThat(events).isEmpty();

        // when
        queue.submit(first);

        // then
        assertThat(events).containsExactly("first", "second");
        assertThat(second.isFinished()).isTrue();
        assertThat(second.getDependencies()).containsExactly(first);
    }

    @Test
    void 완료_블록의_예외는_종료_알림을_막지_않는다() {
        // given
        BlockTask task = new BlockTask("block-failure", () -> { });
        task.addCompletionBlock(() -> {
            throw new IllegalStateException("completion failure");
        });
        task.addCompletionBlock(() -> events.add("second-block"));

        // when
        queue.submit(task);

        // then
        assertThat(events).containsExactly("second-block");
        assertThat(task.whenFinished().toCompletableFuture()).isCompleted();
    }

    // ========== 종료 1회 보장 ==========

    @RepeatedTest(50)
    void 동시_finish_호출은_한_번만_적용된다() throws Exception {
        // given
        Task task = new BlockTask("contended", () -> { });
        AtomicInteger didFinish = new AtomicInteger();
        task.addDidFinishObserver((t, errors) -> didFinish.incrementAndGet());

        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicReference<Throwable> failure = new AtomicReference<>();

        // when
        for (int i = 0; i < threads; i++) {
            TaskError error = TaskError.of("E-" + i, "finisher " + i);
            executor.submit(() -> {
                try {
                    start.await();
                    task.finish(error);
                } catch (Throwable t) {
                    failure.compareAndSet(null, t);
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();

        // then
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        List<TaskError> errors = task.whenFinished().toCompletableFuture().get(5, TimeUnit.SECONDS);
        assertThat(failure.get()).isNull();
        assertThat(didFinish.get()).isEqualTo(1);
        assertThat(errors).hasSize(1);
        assertThat(task.getErrors()).isSameAs(errors);

        executor.shutdown();
    }

    @Test
    void 종료_이후의_finish는_조용히_무시되고_오류는_버려진다() {
        // given
        Task task = new BlockTask("finished", () -> { });
        task.finish();

        // when
        task.finish(TaskError.of("LATE", "late finish"));

        // then
        assertThat(task.isFinished()).isTrue();
        assertThat(task.getErrors()).isEmpty();
    }

    @Test
    void 실행_중_다른_스레드의_finish가_교착되지_않는다() throws Exception {
        // given
        ExecutorService executor = Executors.newFixedThreadPool(2);
        DirectTaskQueue executorQueue = new DirectTaskQueue(executor);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        Consumer<String> track = event -> {
            int current = active.incrementAndGet();
            maxActive.accumulateAndGet(current, Math::max);
            events.add(event);
            active.decrementAndGet();
        };
        BlockTask task = new BlockTask("async-finish", t -> {
            track.accept("execute");
            Thread finisher = new Thread(t::finish);
            finisher.start();
            try {
                finisher.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        task.addObserver(LifecycleEvent.WILL_EXECUTE, (t, errors) -> track.accept("will-execute"));
        task.addObserver(LifecycleEvent.DID_EXECUTE, (t, errors) -> track.accept("did-execute"));
        task.addObserver(LifecycleEvent.WILL_FINISH, (t, errors) -> track.accept("will-finish"));
        task.addDidFinishObserver((t, errors) -> track.accept("did-finish"));

        // when
        executorQueue.submit(task);

        // then
        task.whenFinished().toCompletableFuture().get(5, TimeUnit.SECONDS);
        assertThat(maxActive.get()).isEqualTo(1);
        assertThat(events).containsExactly("will-execute", "execute", "did-execute", "will-finish", "did-finish");

        executor.shutdown();
    }

    // ========== 취소 ==========

    @Test
    void 제출_전_취소는_실행을_건너뛰고_오류를_전달한다() {
        // given
        BlockTask task = new BlockTask("cancelled-early", () -> events.add("execute"));
        recordAllEvents(task);
        TaskError reason = TaskError.cancelled("no longer needed");

        // when
        task.cancel(reason);
        queue.submit(task);

        // then
        assertThat(task.isCancelled()).isTrue();
        assertThat(task.isFinished()).isTrue();
        assertThat(task.getErrors()).containsExactly(reason);
        assertThat(events).containsExactly("did-cancel", "will-finish", "did-finish");
    }

    @Test
    void will_execute_관찰자의_취소는_실행을_막고_오류를_전달한다() {
        // given
        BlockTask task = new BlockTask("cancelled-from-observer", () -> events.add("execute"));
        TaskError reason = TaskError.of("VETO", "rejected by observer");
        task.addWillExecuteObserver(t -> t.cancel(reason));
        AtomicReference<List<TaskError>> finished = new AtomicReference<>();
        task.addDidFinishObserver((t, errors) -> finished.set(errors));

        // when
        queue.submit(task);

        // then
        assertThat(events).isEmpty();
        assertThat(task.getState()).isEqualTo(TaskState.FINISHED);
        assertThat(finished.get()).containsExactly(reason);
    }

    @Test
    void 여러_번의_취소는_오류를_누적하고_did_cancel은_한_번만_호출된다() {
        // given
        Task task = new BlockTask("multi-cancel", () -> { });
        AtomicInteger didCancel = new AtomicInteger();
        task.addObserver(LifecycleEvent.DID_CANCEL, (t, errors) -> didCancel.incrementAndGet());
        TaskError first = TaskError.of("C-1", "first");
        TaskError second = TaskError.of("C-2", "second");

        // when
        task.cancel(first);
        task.cancel(second);
        task.cancel();

        // then
        assertThat(didCancel.get()).isEqualTo(1);
        assertThat(task.getErrors()).containsExactly(first, second);
        assertThat(task.whenCancelled().toCompletableFuture()).isCompleted();
        assertThat(task.getState()).isEqualTo(TaskState.INITIALIZED);
    }

    @Test
    void 종료_이후의_취소는_효과가_없다() {
        // given
        Task task = new BlockTask("finished-then-cancelled", () -> { });
        AtomicInteger didCancel = new AtomicInteger();
        task.addObserver(LifecycleEvent.DID_CANCEL, (t, errors) -> didCancel.incrementAndGet());
        queue.submit(task);

        // when
        task.cancel(TaskError.of("LATE", "too late"));

        // then
        assertThat(task.isCancelled()).isFalse();
        assertThat(task.getErrors()).isEmpty();
        assertThat(didCancel.get()).isZero();
        assertThat(task.whenCancelled().toCompletableFuture()).isNotDone();
    }

    @Test
    void will_finish_관찰자의_취소는_오류를_추가하지만_did_cancel은_호출되지_않는다() {
        // given
        Task task = new BlockTask("cancel-while-finishing", () -> { });
        TaskError reason = TaskError.of("LATE-CANCEL", "cancelled while finishing");
        task.addObserver(LifecycleEvent.WILL_FINISH, (t, errors) -> t.cancel(reason));
        AtomicInteger didCancel = new AtomicInteger();
        task.addObserver(LifecycleEvent.DID_CANCEL, (t, errors) -> didCancel.incrementAndGet());
        AtomicReference<List<TaskError>> finished = new AtomicReference<>();
        task.addDidFinishObserver((t, errors) -> finished.set(errors));

        // when
        queue.submit(task);

        // then
        assertThat(finished.get()).containsExactly(reason);
        assertThat(task.isCancelled()).isTrue();
        assertThat(didCancel.get()).isZero();
    }

    @Test
    void 실패한_전제조건은_취소로_이어지고_실행되지_않는다() {
        // given
        BlockTask task = new BlockTask("guarded", () -> events.add("execute"));
        task.addPrecondition(new BlockCondition("always-false", () -> false));
        task.addPrecondition(new BlockCondition("always-true", () -> true));

        // when
        queue.submit(task);

        // then
        assertThat(events).isEmpty();
        assertThat(task.isCancelled()).isTrue();
        assertThat(task.isFinished()).isTrue();
        assertThat(task.getErrors()).singleElement()
            .extracting(TaskError::code).isEqualTo(BlockCondition.FAILED_CODE);
    }

    @Test
    void 실행_본문의_Error도_Task를_종료시킨다() {
        // given
        AssertionError failure = new AssertionError("invariant broken");
        BlockTask task = new BlockTask("erroring", () -> {
            throw failure;
        });

        // when
        queue.submit(task);

        // then
        assertThat(task.isFinished()).isTrue();
        assertThat(task.whenFinished().toCompletableFuture()).isCompleted();
        assertThat(task.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.code()).isEqualTo(TaskError.EXECUTION_FAILED);
            assertThat(error.cause()).isSameAs(failure);
        });
    }

    // ========== 준비 여부 ==========

    @Test
    void 전제조건을_통과하면_준비_상태가_된다() {
        // given
        BlockTask task = new BlockTask("passing", () -> events.add("execute"));
        task.addPrecondition(new BlockCondition("always-true", () -> true));
        task.enqueue(queue);

        // when
        task.evaluatePreconditions().toCompletableFuture().join();

        // then
        assertThat(task.getState()).isEqualTo(TaskState.READY);
        assertThat(task.isReady()).isTrue();
        assertThat(events).isEmpty();
    }

    @Test
    void 전제조건이_실패하면_준비_상태가_아니다() {
        // given
        BlockTask task = new BlockTask("failing", () -> events.add("execute"));
        task.addPrecondition(new BlockCondition("always-false", () -> false));
        task.enqueue(queue);

        // when
        task.evaluatePreconditions().toCompletableFuture().join();

        // then
        assertThat(task.isReady()).isFalse();
        assertThat(task.isCancelled()).isTrue();
        assertThat(task.isFinished()).isTrue();
        assertThat(events).isEmpty();
    }

    @Test
    void 평가_전에_취소되면_준비_상태가_아니다() {
        // given
        BlockTask task = new BlockTask("cancelled", () -> events.add("execute"));
        task.addPrecondition(new BlockCondition("always-true", () -> true));
        task.enqueue(queue);
        task.cancel(TaskError.cancelled("stopped"));

        // when
        task.evaluatePreconditions().toCompletableFuture().join();

        // then
        assertThat(task.isReady()).isFalse();
        assertThat(task.isFinished()).isTrue();
        assertThat(task.getErrors()).extracting(TaskError::code).containsExactly(TaskError.CANCELLED);
    }

    @Test
    void 준비_상태에서_취소되면_준비_여부는_false가_된다() {
        // given
        BlockTask task = new BlockTask("ready", () -> events.add("execute"));
        task.enqueue(queue);
        task.evaluatePreconditions().toCompletableFuture().join();
        assertThat(task.isReady()).isTrue();

        // when
        task.cancel();

        // then
        assertThat(task.getState()).isEqualTo(TaskState.READY);
        assertThat(task.isReady()).isFalse();
    }

    @RepeatedTest(20)
    void 제출_직후_취소해도_정확히_한_번_종료된다() throws Exception {
        // given
        ExecutorService executor = Executors.newFixedThreadPool(4);
        DirectTaskQueue executorQueue = new DirectTaskQueue(executor);
        AtomicInteger didFinish = new AtomicInteger();
        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            Task task = new BlockTask("race-" + i, () -> { });
            task.addDidFinishObserver((t, errors) -> didFinish.incrementAndGet());
            tasks.add(task);
        }

        // when
        for (Task task : tasks) {
            executorQueue.submit(task);
            task.cancel(TaskError.cancelled("race"));
        }

        // then
        for (Task task : tasks) {
            task.whenFinished().toCompletableFuture().get(5, TimeUnit.SECONDS);
            assertThat(task.getState()).isEqualTo(TaskState.FINISHED);
        }
        assertThat(didFinish.get()).isEqualTo(tasks.size());

        executor.shutdown();
    }

    // ========== 구성 규칙 ==========

    @Test
    void 전제조건_평가가_시작된_후에는_구성을_변경할_수_없다() {
        // given
        AtomicReference<Consumer<ConditionResult>> pending = new AtomicReference<>();
        BlockTask task = new BlockTask("configured", () -> events.add("execute"));
        task.addPrecondition(new Precondition("pending") {
            @Override
            protected void evaluate(TaskReference owner, Consumer<ConditionResult> completion) {
                pending.set(completion);
            }
        });
        queue.submit(task);
        assertThat(task.getState()).isEqualTo(TaskState.EVALUATING_PRECONDITIONS);

        // when & then
        assertThatThrownBy(() -> task.addObserver(LifecycleEvent.DID_FINISH, (t, errors) -> { }))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> task.addPrecondition(new BlockCondition(() -> true)))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> task.addCompletionBlock(() -> { }))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> task.addDependency(new BlockTask(() -> { })))
            .isInstanceOf(IllegalStateException.class);
        assertThat(task.getState()).isEqualTo(TaskState.EVALUATING_PRECONDITIONS);

        // when
        pending.get().accept(ConditionResult.satisfied());

        // then
        assertThat(events).containsExactly("execute");
        assertThat(task.isFinished()).isTrue();
    }

    @Test
    void 하나의_전제조건을_두_Task에_추가할_수_없다() {
        // given
        BlockCondition shared = new BlockCondition("shared", () -> true);
        BlockTask first = new BlockTask("first", () -> { });
        BlockTask second = new BlockTask("second", () -> { });
        first.addPrecondition(shared);

        // when & then
        assertThatThrownBy(() -> second.addPrecondition(shared))
            .isInstanceOf(IllegalStateException.class);
        assertThat(second.getPreconditions()).isEmpty();
        assertThat(first.getPreconditions()).containsExactly(shared);
    }

    @Test
    void 자기_자신을_의존성으로_추가할_수_없다() {
        // given
        Task task = new BlockTask("self", () -> { });

        // when & then
        assertThatThrownBy(() -> task.addDependency(task))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("itself");
    }

    @Test
    void 이미_제출된_Task는_다시_제출할_수_없다() {
        // given
        Task task = new BlockTask("once", () -> { });
        queue.submit(task);

        // when & then
        assertThat(queue.offer(task)).isFalse();
        assertThatThrownBy(() -> queue.submit(task)).isInstanceOf(IllegalStateException.class);
        assertThat(queue.offered()).hasSize(1);
    }

    @Test
    void 종료_전에는_오류_스냅샷을_종료_후에는_불변_목록을_반환한다() {
        // given
        Task task = new BlockTask("errors", () -> { });
        TaskError first = TaskError.of("C-1", "first");
        task.cancel(first);
        List<TaskError> snapshot = task.getErrors();

        // when
        task.cancel(TaskError.of("C-2", "second"));
        task.finish();

        // then
        assertThat(snapshot).containsExactly(first);
        assertThat(task.getErrors()).hasSize(2);
        assertThatThrownBy(() -> task.getErrors().add(first))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void null_오류는_거부된다() {
        // given
        Task task = new BlockTask("nulls", () -> { });

        // when & then
        assertThatThrownBy(() -> task.cancel((TaskError) null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> task.finish((List<TaskError>) null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> task.cancel(Collections.singletonList(null))).isInstanceOf(IllegalArgumentException.class);
        assertThat(task.getState()).isEqualTo(TaskState.INITIALIZED);
        assertThat(task.isCancelled()).isFalse();
    }

    @Test
    void 이름이_없으면_생성된_이름을_사용한다() {
        // when
        Task task = new BlockTask(() -> { });

        // then
        assertThat(task.getName()).startsWith("Task-").hasSize("Task-".length() + 8);

        // when
        task.setName("renamed");

        // then
        assertThat(task.getName()).isEqualTo("renamed");
        assertThatThrownBy(() -> task.setName(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    private void recordAllEvents(Task task) {
        task.addObserver(LifecycleEvent.WILL_EXECUTE, (t, errors) -> events.add("will-execute"));
        task.addObserver(LifecycleEvent.DID_EXECUTE, (t, errors) -> events.add("did-execute"));
        task.addObserver(LifecycleEvent.WILL_FINISH, (t, errors) -> events.add("will-finish"));
        task.addObserver(LifecycleEvent.DID_FINISH, (t, errors) -> events.add("did-finish"));
        task.addObserver(LifecycleEvent.DID_CANCEL, (t, errors) -> events.add("did-cancel"));
    }
}
