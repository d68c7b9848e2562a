package com.ryuqq.procedure.core.observer;

import com.ryuqq.procedure.core.model.TaskError;
import com.ryuqq.procedure.core.task.Task;
import com.ryuqq.procedure.core.task.TaskReference;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 하나의 Task, 하나의 이벤트에 바인딩된 콜백 핸들.
 *
 * <p>핸들은 최대 한 번 호출되며, 호출 이후에는 기록 용도로만 유지됩니다.
 * Task에 대한 참조는 {@link TaskReference}(비소유)로만 보관합니다.</p>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public final class ObserverHandle {

    private final LifecycleEvent event;
    private final long sequence;
    private final LifecycleCallback callback;
    private final TaskReference owner;
    private final AtomicBoolean invoked = new AtomicBoolean(false);

    ObserverHandle(LifecycleEvent event, long sequence, LifecycleCallback callback, TaskReference owner) {
        this.event = event;
        this.sequence = sequence;
        this.callback = callback;
        this.owner = owner;
    }

    /**
     * 콜백 호출 (최초 1회만).
     *
     * @param task 이벤트가 발생한 Task
     * @param errors 오류 목록
     * @return 이번 호출에서 콜백이 실행되었으면 true
     */
    boolean invoke(Task task, List<TaskError> errors) {
        if (!invoked.compareAndSet(false, true)) {
            return false;
        }
        callback.onEvent(task, errors);
        return true;
    }

    public LifecycleEvent getEvent() {
        return event;
    }

    /**
     * 등록 순서 (Task 내에서 단조 증가).
     *
     * @return 등록 순번
     */
    public long getSequence() {
        return sequence;
    }

    public TaskReference getOwner() {
        return owner;
    }

    public boolean isInvoked() {
        return invoked.get();
    }

    @Override
    public String toString() {
        return "ObserverHandle{" + event + "#" + sequence + ", invoked=" + invoked.get() + '}';
    }
}
