package com.ryuqq.procedure.core.observer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Task별 직렬 이벤트 큐.
 *
 * <p>dispatch된 이벤트를 FIFO 순서로 한 번에 하나씩 실행합니다.
 * 어떤 스레드에서 dispatch하든 같은 Task의 두 이벤트가 동시에 실행되는 일은 없습니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>이벤트를 큐에 추가</li>
 *   <li>drain 중인 스레드가 없으면 drain 권한을 CAS로 획득하고 바인딩된 Executor에 drain 작업 제출</li>
 *   <li>drain 작업은 큐가 빌 때까지 이벤트를 실행</li>
 *   <li>권한 반납 후 그 사이 추가된 이벤트가 있으면 다시 스케줄</li>
 * </ol>
 *
 * <p><strong>재진입:</strong> 이벤트 안에서 dispatch하면 현재 이벤트 뒤에 줄을 서며,
 * 호출자는 블로킹되지 않습니다. 따라서 관찰자가 cancel/finish를 다시 호출해도 교착 상태가 발생하지 않습니다.</p>
 *
 * <p><strong>Executor:</strong> 큐에 제출되기 전에는 호출 스레드에서 바로 drain하고,
 * 제출 이후에는 큐의 Executor에서 drain합니다. Executor가 작업을 거부하면 호출 스레드에서 drain합니다.</p>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public final class SerialDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SerialDispatcher.class);
    private static final Executor CALLER_THREAD = Runnable::run;

    private final String name;
    private final Queue<Runnable> events = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private volatile Executor executor = CALLER_THREAD;

    public SerialDispatcher(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    /**
     * drain에 사용할 Executor 바인딩.
     *
     * @param executor 이후 이벤트를 실행할 Executor
     * @throws IllegalArgumentException executor가 null인 경우
     */
    public void bind(Executor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.executor = executor;
    }

    /**
     * 이벤트 추가. 호출자를 블로킹하지 않습니다.
     *
     * @param event 실행할 이벤트
     * @throws IllegalArgumentException event가 null인 경우
     */
    public void dispatch(Runnable event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        events.add(event);
        schedule();
    }

    /**
     * 대기 중인 이벤트 수 (테스트 확인용).
     *
     * @return 큐에 남은 이벤트 수
     */
    public int pendingEvents() {
        return events.size();
    }

    private void schedule() {
        if (events.isEmpty() || !draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            log.warn("Executor rejected events of {}, draining on caller thread", name);
            drain();
        }
    }

    private void drain() {
        try {
            Runnable event;
            while ((event = events.poll()) != null) {
                try {
                    event.run();
                } catch (RuntimeException e) {
                    log.error("Lifecycle event of {} failed", name, e);
                }
            }
        } finally {
            draining.set(false);
            // 권한 반납 전에 추가된 이벤트, 또는 Error로 중단된 뒤 남은 이벤트 처리
            schedule();
        }
    }
}
