package com.ryuqq.procedure.core.task;

import com.ryuqq.procedure.core.model.TaskId;

import java.lang.ref.WeakReference;
import java.util.Optional;

/**
 * Task에 대한 비소유 참조.
 *
 * <p>관찰자 핸들과 전제조건 콜백은 Task를 직접 참조하지 않고 이 참조를 보관합니다.
 * 참조는 Task의 수명을 연장하지 않으며, 콜백은 Task 상태에 접근하기 전에 반드시
 * {@link #get()} 또는 {@link #isAlive()}로 생존 여부를 확인해야 합니다.</p>
 *
 * <p><strong>생존 판정:</strong> Task가 수거되었거나 이미 FINISHED이면 부재로 취급합니다.
 * 프레임워크는 콜백에게 살아 있는 Task를 보장하지 않습니다.</p>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public final class TaskReference {

    private final TaskId taskId;
    private final WeakReference<Task> task;

    TaskReference(Task task) {
        this.taskId = task.getId();
        this.task = new WeakReference<>(task);
    }

    /**
     * 살아 있는 Task 조회.
     *
     * @return 수거되지 않았고 종료되지 않은 Task, 그 외에는 empty
     */
    public Optional<Task> get() {
        Task current = task.get();
        if (current == null || current.isFinished()) {
            return Optional.empty();
        }
        return Optional.of(current);
    }

    public boolean isAlive() {
        return get().isPresent();
    }

    /**
     * 수거 여부와 무관하게 참조 대상이 메모리에서 해제되었는지 확인.
     *
     * @return Task가 GC로 수거되었으면 true
     */
    public boolean isCollected() {
        return task.get() == null;
    }

    public TaskId getTaskId() {
        return taskId;
    }

    @Override
    public String toString() {
        return "TaskReference{" + taskId.shortValue() + (isCollected() ? ", collected" : "") + '}';
    }
}
