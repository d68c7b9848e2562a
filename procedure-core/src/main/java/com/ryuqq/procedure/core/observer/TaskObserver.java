package com.ryuqq.procedure.core.observer;

import com.ryuqq.procedure.core.model.TaskError;
import com.ryuqq.procedure.core.task.Task;

import java.util.List;

/**
 * 여러 생명주기 이벤트를 한 번에 관찰하는 관찰자.
 *
 * <p>모든 메서드는 기본 no-op 구현을 가지며, 필요한 이벤트만 재정의합니다.
 * 등록 시 이벤트마다 하나의 {@link ObserverHandle}이 생성됩니다.</p>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public interface TaskObserver {

    default void willExecute(Task task) {}

    default void didExecute(Task task) {}

    default void willFinish(Task task, List<TaskError> errors) {}

    default void didFinish(Task task, List<TaskError> errors) {}

    default void didCancel(Task task, List<TaskError> errors) {}
}
