package com.ryuqq.procedure.core.condition;

import com.ryuqq.procedure.core.model.TaskError;
import com.ryuqq.procedure.core.task.Task;
import com.ryuqq.procedure.core.task.TaskReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Task 실행 전에 평가되는 전제조건.
 *
 * <p>전제조건은 선택적으로 생성 의존성(produced dependencies)을 가질 수 있습니다.
 * 생성 의존성은 평가 전에 큐에 제출되고, 모두 종료된 뒤에야 전제조건이 평가됩니다.</p>
 *
 * <p><strong>평가 규약:</strong></p>
 * <ul>
 *   <li>{@link #evaluate(TaskReference)}는 여러 번 호출되어도 본문은 최대 한 번만 실행됩니다.</li>
 *   <li>본문은 콜백 방식이며, 결과를 다른 스레드에서 나중에 전달해도 됩니다.</li>
 *   <li>소유 Task는 비소유 참조({@link TaskReference})로만 전달됩니다. 결과가 전달될 때
 *       Task가 이미 종료되었을 수 있으며, 그 경우 결과는 버려집니다.</li>
 *   <li>본문이 던진 예외는 {@link ConditionResult.Failed}로 변환됩니다.</li>
 *   <li>인스턴스는 하나의 Task에만 연결됩니다. 다른 Task에 다시 연결하면
 *       {@link IllegalStateException}이 발생합니다.</li>
 * </ul>
 *
 * <p><strong>구현 예시:</strong></p>
 * <pre>
 * public class InventoryCondition extends Precondition {
 *     protected void evaluate(TaskReference owner, Consumer&lt;ConditionResult&gt; completion) {
 *         inventoryClient.checkAsync(sku, available -&gt; completion.accept(
 *             available ? ConditionResult.satisfied()
 *                       : ConditionResult.failed(TaskError.of("STOCK-001", "out of stock"))));
 *     }
 * }
 * </pre>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public abstract class Precondition {

    private static final Logger log = LoggerFactory.getLogger(Precondition.class);

    private final String name;
    private final Set<Task> producedDependencies = Collections.synchronizedSet(new LinkedHashSet<>());
    private final AtomicReference<CompletableFuture<ConditionResult>> evaluation = new AtomicReference<>();
    private final AtomicInteger evaluationCount = new AtomicInteger();
    private final AtomicReference<TaskReference> attachedOwner = new AtomicReference<>();

    protected Precondition() {
        this(null);
    }

    protected Precondition(String name) {
        this.name = (name == null || name.isBlank()) ? defaultName(getClass()) : name;
    }

    /**
     * 생성 의존성 추가.
     *
     * @param dependency 평가 전에 종료되어야 하는 Task
     * @throws IllegalArgumentException dependency가 null인 경우
     * @throws IllegalStateException 이미 평가가 시작된 경우
     */
    public void addProducedDependency(Task dependency) {
        if (dependency == null) {
            throw new IllegalArgumentException("dependency cannot be null");
        }
        if (evaluation.get() != null) {
            throw new IllegalStateException("Cannot add produced dependency to " + name + " after evaluation started");
        }
        producedDependencies.add(dependency);
    }

    /**
     * 소유 Task에 연결. 같은 Task에 대한 반복 호출은 허용됩니다.
     *
     * @param owner 소유 Task의 비소유 참조
     * @throws IllegalArgumentException owner가 null인 경우
     * @throws IllegalStateException 이미 다른 Task에 연결된 경우
     */
    public final void attach(TaskReference owner) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        if (!attachedOwner.compareAndSet(null, owner) && attachedOwner.get() != owner) {
            throw new IllegalStateException("Precondition " + name + " is already attached to task "
                + attachedOwner.get().getTaskId().shortValue());
        }
    }

    public Set<Task> getProducedDependencies() {
        synchronized (producedDependencies) {
            return Set.copyOf(producedDependencies);
        }
    }

    /**
     * 전제조건 평가 (최대 1회).
     *
     * <p>두 번째 이후 호출은 최초 평가의 결과를 그대로 반환합니다.</p>
     *
     * @param owner 소유 Task의 비소유 참조
     * @return 평가 결과
     * @throws IllegalArgumentException owner가 null인 경우
     * @throws IllegalStateException 다른 Task에 연결된 인스턴스인 경우
     */
    public final CompletionStage<ConditionResult> evaluate(TaskReference owner) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        attach(owner);
        CompletableFuture<ConditionResult> result = new CompletableFuture<>();
        if (!evaluation.compareAndSet(null, result)) {
            log.debug("Precondition {} already evaluated for task {}", name, owner.getTaskId().shortValue());
            return evaluation.get();
        }

        evaluationCount.incrementAndGet();
        try {
            evaluate(owner, outcome -> complete(owner, result, outcome));
        } catch (RuntimeException e) {
            result.complete(ConditionResult.failed(TaskError.fromException(e)));
        }
        return result;
    }

    /**
     * 전제조건 본문.
     *
     * <p>completion은 정확히 한 번 호출되어야 하며, 추가 호출은 무시됩니다.
     * owner가 이미 종료되었을 수 있으므로 Task 상태가 필요하면 {@link TaskReference#get()}으로 확인해야 합니다.</p>
     *
     * @param owner 소유 Task의 비소유 참조
     * @param completion 결과 전달 콜백
     */
    protected abstract void evaluate(TaskReference owner, Consumer<ConditionResult> completion);

    private void complete(TaskReference owner, CompletableFuture<ConditionResult> result, ConditionResult outcome) {
        ConditionResult resolved = outcome != null
            ? outcome
            : ConditionResult.failed(TaskError.of("CONDITION-NULL", "Precondition " + name + " completed without a result"));

        if (!owner.isAlive()) {
            log.debug("Precondition {} completed after task {} finished, result discarded",
                name, owner.getTaskId().shortValue());
        }
        if (!result.complete(resolved)) {
            log.debug("Precondition {} completed more than once, later result ignored", name);
        }
    }

    private static String defaultName(Class<?> type) {
        String simpleName = type.getSimpleName();
        return simpleName.isEmpty() ? type.getName() : simpleName;
    }

    public String getName() {
        return name;
    }

    /**
     * 본문이 실행된 횟수 (0 또는 1).
     *
     * @return 평가 횟수
     */
    public int evaluationCount() {
        return evaluationCount.get();
    }

    public boolean isEvaluated() {
        CompletableFuture<ConditionResult> current = evaluation.get();
        return current != null && current.isDone();
    }

    @Override
    public String toString() {
        return "Precondition{" + name + '}';
    }
}
