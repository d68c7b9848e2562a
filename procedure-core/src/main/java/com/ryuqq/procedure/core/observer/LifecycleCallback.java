package com.ryuqq.procedure.core.observer;

import com.ryuqq.procedure.core.model.TaskError;
import com.ryuqq.procedure.core.task.Task;

import java.util.List;

/**
 * 생명주기 이벤트 콜백.
 *
 * <p>콜백은 Task에 대한 참조를 보관하지 않고, 호출 시점에 Task와 현재 오류 목록을 인자로 받습니다.
 * 콜백 안에서 {@link Task#cancel(List)} 또는 {@link Task#finish(List)}를 다시 호출해도 안전합니다.</p>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface LifecycleCallback {

    /**
     * 이벤트 처리.
     *
     * @param task 이벤트가 발생한 Task
     * @param errors 호출 시점의 오류 목록 (DID_FINISH에서는 동결된 최종 목록)
     */
    void onEvent(Task task, List<TaskError> errors);
}
