package com.ryuqq.procedure.core.observer;

import com.ryuqq.procedure.core.model.TaskError;
import com.ryuqq.procedure.core.task.Task;
import com.ryuqq.procedure.core.task.TaskReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Task별 생명주기 관찰자 레지스트리.
 *
 * <p>이벤트마다 등록 순서대로 정렬된 핸들 목록을 보관합니다.
 * 레지스트리는 Task를 소유하지 않으며, 콜백은 호출 시점에 Task와 오류 목록을 인자로 받습니다.</p>
 *
 * <p><strong>직렬화:</strong> {@link #notify(LifecycleEvent, Task, List)}는 Task의
 * {@link SerialDispatcher} 이벤트 안에서만 호출되므로, 같은 Task의 두 이벤트 알림은 동시에 실행되지 않습니다.</p>
 *
 * <p><strong>예외 처리:</strong> 콜백이 던진 예외는 로그로 남기고 다음 콜백을 계속 호출합니다.
 * 관찰자의 오류가 생명주기를 중단시키지 않습니다.</p>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public final class ObserverRegistry {

    private static final Logger log = LoggerFactory.getLogger(ObserverRegistry.class);

    private final TaskReference owner;
    private final Map<LifecycleEvent, List<ObserverHandle>> handles;
    private final AtomicLong sequence = new AtomicLong();

    /**
     * 생성자.
     *
     * @param owner 레지스트리를 소유한 Task의 비소유 참조
     * @throws IllegalArgumentException owner가 null인 경우
     */
    public ObserverRegistry(TaskReference owner) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        this.owner = owner;
        this.handles = new EnumMap<>(LifecycleEvent.class);
        for (LifecycleEvent event : LifecycleEvent.values()) {
            handles.put(event, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * 이벤트 콜백 등록.
     *
     * @param event 생명주기 이벤트
     * @param callback 콜백
     * @return 등록된 핸들
     * @throws IllegalArgumentException event 또는 callback이 null인 경우
     */
    public ObserverHandle add(LifecycleEvent event, LifecycleCallback callback) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        ObserverHandle handle = new ObserverHandle(event, sequence.incrementAndGet(), callback, owner);
        handles.get(event).add(handle);
        return handle;
    }

    /**
     * TaskObserver 등록 (이벤트마다 핸들 하나).
     *
     * @param observer 관찰자
     * @return 등록된 핸들 목록 (이벤트 선언 순)
     * @throws IllegalArgumentException observer가 null인 경우
     */
    public List<ObserverHandle> add(TaskObserver observer) {
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }
        List<ObserverHandle> registered = new ArrayList<>(LifecycleEvent.values().length);
        registered.add(add(LifecycleEvent.WILL_EXECUTE, (task, errors) -> observer.willExecute(task)));
        registered.add(add(LifecycleEvent.DID_EXECUTE, (task, errors) -> observer.didExecute(task)));
        registered.add(add(LifecycleEvent.WILL_FINISH, observer::willFinish));
        registered.add(add(LifecycleEvent.DID_FINISH, observer::didFinish));
        registered.add(add(LifecycleEvent.DID_CANCEL, observer::didCancel));
        return registered;
    }

    /**
     * 이벤트의 모든 콜백을 등록 순서대로 호출.
     *
     * @param event 생명주기 이벤트
     * @param task 이벤트가 발생한 Task
     * @param errors 콜백에 전달할 오류 목록
     * @return 이번 알림에서 실제로 호출된 콜백 수
     */
    public int notify(LifecycleEvent event, Task task, List<TaskError> errors) {
        int invoked = 0;
        for (ObserverHandle handle : handles.get(event)) {
            try {
                if (handle.invoke(task, errors)) {
                    invoked++;
                }
            } catch (RuntimeException e) {
                log.error("Observer {} failed for task {}", handle, task.getName(), e);
            }
        }
        return invoked;
    }

    /**
     * 이벤트에 등록된 핸들 조회 (기록용 스냅샷).
     *
     * @param event 생명주기 이벤트
     * @return 핸들 목록 (불변)
     */
    public List<ObserverHandle> handles(LifecycleEvent event) {
        return List.copyOf(handles.get(event));
    }

    public int size() {
        int size = 0;
        for (List<ObserverHandle> list : handles.values()) {
            size += list.size();
        }
        return size;
    }
}
