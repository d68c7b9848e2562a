package com.ryuqq.procedure.core.task;

import com.ryuqq.procedure.core.condition.EvaluationSummary;
import com.ryuqq.procedure.core.condition.Precondition;
import com.ryuqq.procedure.core.condition.PreconditionEvaluator;
import com.ryuqq.procedure.core.model.TaskError;
import com.ryuqq.procedure.core.model.TaskId;
import com.ryuqq.procedure.core.observer.LifecycleCallback;
import com.ryuqq.procedure.core.observer.LifecycleEvent;
import com.ryuqq.procedure.core.observer.ObserverHandle;
import com.ryuqq.procedure.core.observer.ObserverRegistry;
import com.ryuqq.procedure.core.observer.SerialDispatcher;
import com.ryuqq.procedure.core.observer.TaskObserver;
import com.ryuqq.procedure.core.spi.QueueableTask;
import com.ryuqq.procedure.core.spi.TaskQueue;
import com.ryuqq.procedure.core.statemachine.StateTransition;
import com.ryuqq.procedure.core.statemachine.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * 생명주기를 가진 비동기 작업 단위.
 *
 * <p>Task는 생성 후 전제조건, 관찰자, 의존성을 연결하고 {@link TaskQueue}에 제출합니다.
 * 큐는 의존성 대기 → 전제조건 평가 → 실행 순으로 Task를 진행시키며,
 * 어떤 경로로든 정확히 한 번의 종료 전이가 일어납니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * INITIALIZED → PENDING → EVALUATING_PRECONDITIONS → READY → EXECUTING → FINISHING → FINISHED
 * </pre>
 *
 * <p><strong>종료 1회 보장:</strong> {@link #finish(List)}는 상태에 대한 단일 compare-and-set으로
 * FINISHING을 선점합니다. 동시에 여러 호출자가 경쟁해도 한 호출의 효과만 적용되고,
 * 나머지 호출은 오류나 예외 없이 조용히 반환합니다.</p>
 *
 * <p><strong>협력적 취소:</strong> {@link #cancel(List)}는 플래그를 설정하고 오류를 추가할 뿐
 * 종료를 강제하지 않습니다. 실행 본문은 {@link #isCancelled()}를 확인해 스스로 멈춰야 하며,
 * 실행이 시작되기 전에 취소된 Task는 will-execute 관찰자와 실행 본문을 건너뛰고 곧바로 종료 처리됩니다.</p>
 *
 * <p><strong>이벤트 직렬화:</strong> 관찰자 알림과 실행 본문은 Task별 {@link SerialDispatcher}에서
 * 한 번에 하나씩 실행됩니다. 관찰자 안에서 cancel/finish를 다시 호출하면 현재 이벤트 뒤에 줄을 서므로
 * 교착 상태 없이 같은 1회 보장 규칙으로 처리됩니다.</p>
 *
 * <p><strong>순서 보장:</strong></p>
 * <ul>
 *   <li>will-execute 관찰자가 모두 끝난 뒤 실행 본문 시작</li>
 *   <li>will-finish 관찰자가 모두 끝난 뒤 FINISHED</li>
 *   <li>did-finish 관찰자는 오류 목록이 동결된 뒤에 호출</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Task task = new BlockTask("report", t -&gt; generateReport());
 * task.addPrecondition(new BlockCondition(() -&gt; storage.isWritable()));
 * task.addDidFinishObserver((t, errors) -&gt; log.info("done: {}", errors));
 * queue.submit(task);
 * </pre>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public abstract class Task implements QueueableTask {

    private static final Logger log = LoggerFactory.getLogger(Task.class);
    private static final PreconditionEvaluator EVALUATOR = new PreconditionEvaluator();

    private final TaskId id;
    private volatile String name;
    private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.INITIALIZED);
    private final AtomicReference<TaskQueue> queue = new AtomicReference<>();

    private final Object errorLock = new Object();
    private final List<TaskError> accumulatedErrors = new ArrayList<>();
    private volatile List<TaskError> finalErrors;
    private volatile boolean cancelled;

    private final Set<Task> dependencies = Collections.synchronizedSet(new LinkedHashSet<>());
    private final List<Precondition> preconditions = new CopyOnWriteArrayList<>();
    private final List<Runnable> completionBlocks = new CopyOnWriteArrayList<>();

    private final TaskReference reference;
    private final ObserverRegistry observers;
    private final SerialDispatcher dispatcher;

    private final CompletableFuture<List<TaskError>> completion = new CompletableFuture<>();
    private final CompletableFuture<Void> cancellation = new CompletableFuture<>();
    private final CompletionStage<List<TaskError>> completionView = completion.minimalCompletionStage();
    private final CompletionStage<Void> cancellationView = cancellation.minimalCompletionStage();

    protected Task() {
        this(null);
    }

    protected Task(String name) {
        this.id = TaskId.generate();
        this.name = (name == null || name.isBlank()) ? "Task-" + id.shortValue() : name;
        this.reference = new TaskReference(this);
        this.observers = new ObserverRegistry(reference);
        this.dispatcher = new SerialDispatcher(this.name);
    }

    /**
     * 실행 본문.
     *
     * <p>작업이 끝나면 (동기든 비동기든) 반드시 {@link #finish()}를 호출해야 합니다.
     * 본문이 던진 예외는 {@link TaskError#fromException(Throwable)} 오류와 함께 Task를 종료시킵니다.
     * 오래 걸리는 본문은 {@link #isCancelled()}를 주기적으로 확인해야 합니다.</p>
     */
    protected abstract void execute();

    // ========== 공개 연산: 취소 / 종료 ==========

    public final void cancel() {
        cancel(List.of());
    }

    public final void cancel(TaskError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        cancel(List.of(error));
    }

    /**
     * 취소 요청.
     *
     * <p>어떤 스레드에서든, FINISHED 이전 어느 상태에서든, 몇 번이든 호출할 수 있습니다.
     * 플래그를 설정하고 오류를 추가하며, 최초 호출에서만 취소 신호와 did-cancel 알림이 발생합니다.</p>
     *
     * <p>오류 목록이 이미 동결된 뒤의 호출은 아무 효과가 없습니다 (플래그도 설정되지 않음).
     * FINISHING 도중의 호출(예: will-finish 관찰자)은 오류를 추가합니다.</p>
     *
     * @param errors 추가할 오류 (빈 목록 허용)
     * @throws IllegalArgumentException errors가 null이거나 null 원소를 포함하는 경우
     */
    public final void cancel(List<TaskError> errors) {
        List<TaskError> additions = requireErrors(errors);
        boolean first;
        synchronized (errorLock) {
            if (finalErrors != null) {
                log.debug("Ignoring cancel of {}: errors already frozen", name);
                return;
            }
            accumulatedErrors.addAll(additions);
            first = !cancelled;
            cancelled = true;
        }

        if (first) {
            log.debug("Task {} cancelled in state {} with {} error(s)", name, state.get(), additions.size());
            cancellation.complete(null);
            dispatcher.dispatch(this::didCancelEvent);
        }
    }

    public final void finish() {
        finish(List.of());
    }

    public final void finish(TaskError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        finish(List.of(error));
    }

    /**
     * 종료 요청.
     *
     * <p>상태에 대한 단일 compare-and-set으로 FINISHING을 선점한 호출만 효과가 있습니다.
     * 이미 FINISHING/FINISHED인 Task에 대한 호출은 조용히 무시되며, 그 오류는 기록되지 않습니다.</p>
     *
     * @param errors 추가할 오류 (빈 목록 허용)
     * @throws IllegalArgumentException errors가 null이거나 null 원소를 포함하는 경우
     */
    @Override
    public final void finish(List<TaskError> errors) {
        List<TaskError> additions = requireErrors(errors);
        TaskState current;
        do {
            current = state.get();
            if (current.isFinishing()) {
                log.debug("Ignoring finish of {}: already {}", name, current);
                return;
            }
            StateTransition.validate(current, TaskState.FINISHING);
        } while (!state.compareAndSet(current, TaskState.FINISHING));

        log.debug("Task {} finishing from {} with {} error(s)", name, current, additions.size());
        synchronized (errorLock) {
            accumulatedErrors.addAll(additions);
        }
        dispatcher.dispatch(this::finishingEvent);
    }

    // ========== 큐 연동 ==========

    @Override
    public final boolean enqueue(TaskQueue target) {
        if (target == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (!queue.compareAndSet(null, target)) {
            return false;
        }
        dispatcher.bind(target.executor());
        if (!advance(TaskState.INITIALIZED, TaskState.PENDING)) {
            log.debug("Task {} not enqueued: state {}", name, state.get());
            return false;
        }
        log.debug("Task {} enqueued with {} dependencies", name, dependencies.size());
        return true;
    }

    @Override
    public final CompletionStage<Void> evaluatePreconditions() {
        if (!advance(TaskState.PENDING, TaskState.EVALUATING_PRECONDITIONS)) {
            log.debug("Skipping precondition evaluation of {}: state {}", name, state.get());
            return CompletableFuture.completedFuture(null);
        }

        TaskReference owner = reference;
        return EVALUATOR.evaluate(owner, List.copyOf(preconditions), queue.get(), cancellation)
            .thenAccept(summary -> owner.get().ifPresent(task -> task.preconditionsEvaluated(summary)));
    }

    @Override
    public final void start() {
        dispatcher.dispatch(this::executeEvent);
    }

    private void preconditionsEvaluated(EvaluationSummary summary) {
        if (summary.hasFailures()) {
            log.debug("Task {} failed {} precondition(s)", name, summary.failures().size());
            cancel(summary.failures());
        }
        if (cancelled) {
            log.debug("Task {} cancelled during precondition evaluation", name);
            finish();
            return;
        }
        if (!advance(TaskState.EVALUATING_PRECONDITIONS, TaskState.READY)) {
            log.debug("Task {} finished while evaluating preconditions", name);
        }
    }

    // ========== 직렬 이벤트 ==========

    private void executeEvent() {
        TaskState current = state.get();
        if (current != TaskState.READY) {
            log.debug("Task {} not started: state {}", name, current);
            return;
        }
        if (cancelled) {
            log.debug("Task {} cancelled before execution", name);
            finish();
            return;
        }

        observers.notify(LifecycleEvent.WILL_EXECUTE, this, getErrors());

        if (cancelled) {
            log.debug("Task {} cancelled by a will-execute observer", name);
            finish();
            return;
        }
        if (!advance(TaskState.READY, TaskState.EXECUTING)) {
            return;
        }

        try {
            execute();
        } catch (RuntimeException e) {
            log.error("Task {} threw from execute()", name, e);
            finish(TaskError.fromException(e));
        } catch (Error e) {
            log.error("Task {} threw from execute()", name, e);
            finish(TaskError.fromException(e));
            throw e;
        }

        observers.notify(LifecycleEvent.DID_EXECUTE, this, getErrors());
    }

    private void didCancelEvent() {
        if (state.get().isTerminal()) {
            log.debug("Task {} already finished, did-cancel observers skipped", name);
            return;
        }
        observers.notify(LifecycleEvent.DID_CANCEL, this, getErrors());
    }

    private void finishingEvent() {
        observers.notify(LifecycleEvent.WILL_FINISH, this, getErrors());

        List<TaskError> frozen;
        synchronized (errorLock) {
            frozen = List.copyOf(accumulatedErrors);
            finalErrors = frozen;
        }
        advance(TaskState.FINISHING, TaskState.FINISHED);
        log.debug("Task {} finished with {} error(s)", name, frozen.size());

        observers.notify(LifecycleEvent.DID_FINISH, this, frozen);
        for (Runnable block : completionBlocks) {
            try {
                block.run();
            } catch (RuntimeException e) {
                log.error("Completion block of {} failed", name, e);
            }
        }
        completion.complete(frozen);
    }

    // ========== 구성 (제출 전) ==========

    /**
     * 의존성 추가.
     *
     * @param dependency 이 Task보다 먼저 종료되어야 하는 Task
     * @throws IllegalArgumentException dependency가 null이거나 자기 자신인 경우
     * @throws IllegalStateException 이미 제출된 경우
     */
    public final void addDependency(Task dependency) {
        if (dependency == null) {
            throw new IllegalArgumentException("dependency cannot be null");
        }
        if (dependency == this) {
            throw new IllegalArgumentException("Task " + name + " cannot depend on itself");
        }
        requireBefore(TaskState.PENDING, "add dependency");
        dependencies.add(dependency);
    }

    /**
     * 전제조건 추가.
     *
     * @param precondition 전제조건
     * @throws IllegalArgumentException precondition이 null인 경우
     * @throws IllegalStateException 전제조건 평가가 이미 시작되었거나 precondition이 다른 Task에 연결된 경우
     */
    public final void addPrecondition(Precondition precondition) {
        if (precondition == null) {
            throw new IllegalArgumentException("precondition cannot be null");
        }
        requireBefore(TaskState.EVALUATING_PRECONDITIONS, "add precondition");
        precondition.attach(reference);
        preconditions.add(precondition);
    }

    /**
     * 관찰자 추가.
     *
     * @param event 생명주기 이벤트
     * @param callback 콜백
     * @return 등록된 핸들
     * @throws IllegalArgumentException event 또는 callback이 null인 경우
     * @throws IllegalStateException 전제조건 평가가 이미 시작된 경우
     */
    public final ObserverHandle addObserver(LifecycleEvent event, LifecycleCallback callback) {
        requireBefore(TaskState.EVALUATING_PRECONDITIONS, "add observer");
        return observers.add(event, callback);
    }

    public final List<ObserverHandle> addObserver(TaskObserver observer) {
        requireBefore(TaskState.EVALUATING_PRECONDITIONS, "add observer");
        return observers.add(observer);
    }

    public final ObserverHandle addWillExecuteObserver(Consumer<Task> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        return addObserver(LifecycleEvent.WILL_EXECUTE, (task, errors) -> callback.accept(task));
    }

    public final ObserverHandle addDidFinishObserver(LifecycleCallback callback) {
        return addObserver(LifecycleEvent.DID_FINISH, callback);
    }

    /**
     * 완료 블록 추가. did-finish 관찰자 이후, 종료 알림 직전에 한 번 실행됩니다.
     *
     * @param block 완료 블록
     * @throws IllegalArgumentException block이 null인 경우
     * @throws IllegalStateException 전제조건 평가가 이미 시작된 경우
     */
    public final void addCompletionBlock(Runnable block) {
        if (block == null) {
            throw new IllegalArgumentException("block cannot be null");
        }
        requireBefore(TaskState.EVALUATING_PRECONDITIONS, "add completion block");
        completionBlocks.add(block);
    }

    // ========== 조회 ==========

    @Override
    public final TaskId getId() {
        return id;
    }

    @Override
    public final String getName() {
        return name;
    }

    public final void setName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    @Override
    public final TaskState getState() {
        return state.get();
    }

    /**
     * 준비 여부. 의존성이 끝나고 전제조건이 실패 없이 판정되었으며 취소되지 않은 경우에만 true.
     *
     * @return READY 상태이고 취소되지 않았으면 true
     */
    @Override
    public final boolean isReady() {
        return state.get() == TaskState.READY && !cancelled;
    }

    public final boolean isExecuting() {
        return state.get() == TaskState.EXECUTING;
    }

    @Override
    public final boolean isCancelled() {
        return cancelled;
    }

    @Override
    public final boolean isFinished() {
        return state.get() == TaskState.FINISHED;
    }

    /**
     * 누적 오류 조회.
     *
     * <p>FINISHED 이후에는 동결된 불변 목록을 잠금 없이 반환하고,
     * 그 이전에는 호출 시점의 스냅샷을 반환합니다 (최종 결과가 아님).</p>
     *
     * @return 오류 목록 (불변)
     */
    public final List<TaskError> getErrors() {
        List<TaskError> frozen = finalErrors;
        if (frozen != null) {
            return frozen;
        }
        synchronized (errorLock) {
            return finalErrors != null ? finalErrors : List.copyOf(accumulatedErrors);
        }
    }

    @Override
    public final Set<Task> getDependencies() {
        synchronized (dependencies) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        }
    }

    public final List<Precondition> getPreconditions() {
        return List.copyOf(preconditions);
    }

    public final List<ObserverHandle> getObserverHandles(LifecycleEvent event) {
        return observers.handles(event);
    }

    @Override
    public final CompletionStage<List<TaskError>> whenFinished() {
        return completionView;
    }

    @Override
    public final CompletionStage<Void> whenCancelled() {
        return cancellationView;
    }

    /**
     * 비소유 참조 조회.
     *
     * @return 이 Task의 TaskReference
     */
    public final TaskReference reference() {
        return reference;
    }

    @Override
    public String toString() {
        return "Task{" + name + ", state=" + state.get() + ", cancelled=" + cancelled + '}';
    }

    // ========== 내부 ==========

    private boolean advance(TaskState from, TaskState to) {
        StateTransition.validate(from, to);
        return state.compareAndSet(from, to);
    }

    private void requireBefore(TaskState limit, String action) {
        TaskState current = state.get();
        if (!current.isBefore(limit)) {
            throw new IllegalStateException("Cannot " + action + " to task " + name + " in state " + current);
        }
    }

    private static List<TaskError> requireErrors(List<TaskError> errors) {
        if (errors == null) {
            throw new IllegalArgumentException("errors cannot be null");
        }
        for (TaskError error : errors) {
            if (error == null) {
                throw new IllegalArgumentException("errors cannot contain null");
            }
        }
        return List.copyOf(errors);
    }
}
