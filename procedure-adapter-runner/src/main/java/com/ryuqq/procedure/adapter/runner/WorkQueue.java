package com.ryuqq.procedure.adapter.runner;

import com.ryuqq.procedure.core.model.TaskError;
import com.ryuqq.procedure.core.spi.QueueableTask;
import com.ryuqq.procedure.core.spi.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 고정 크기 스레드 풀 기반 Task 큐.
 *
 * <p>제출된 Task를 의존성 대기 → 전제조건 평가 → 실행 순으로 진행시킵니다.
 * 큐는 Task 상태를 직접 변경하지 않고 {@link QueueableTask}의 연산만 호출합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * offer(task)
 *   ↓
 * task.enqueue(this) → PENDING
 *   ↓
 * 모든 의존성의 whenFinished() 또는 task.whenCancelled() 대기 (논블로킹)
 *   ↓
 * 작업 스레드에서 task.evaluatePreconditions() → READY
 *   ↓
 * task.start() → 실행 본문 (Task의 직렬 이벤트 큐)
 *   ↓
 * task.whenFinished() → in-flight 해제
 * </pre>
 *
 * <p><strong>수명 관리:</strong> 큐는 제출된 Task를 종료될 때까지 강하게 참조합니다.
 * Task 쪽 콜백들은 약한 참조만 가지므로, 큐가 Task를 놓는 시점이 곧 Task가 수거 가능해지는 시점입니다.</p>
 *
 * <p><strong>주의:</strong> 의존성 Task는 별도로 제출해야 합니다. 제출되지 않은 의존성은 종료되지 않으므로
 * 해당 Task는 취소되기 전까지 PENDING에 머무릅니다.</p>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public final class WorkQueue implements TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(WorkQueue.class);

    private final WorkQueueConfig config;
    private final ExecutorService workers;
    private final Set<QueueableTask> inFlight = ConcurrentHashMap.newKeySet();
    private final Object idleLock = new Object();
    private volatile boolean shutdown;

    /**
     * 생성자 (기본 설정 사용).
     */
    public WorkQueue() {
        this(new WorkQueueConfig());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public WorkQueue(WorkQueueConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.workers = Executors.newFixedThreadPool(config.concurrency(), new WorkerThreadFactory(config.name()));
    }

    @Override
    public boolean offer(QueueableTask task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (shutdown) {
            throw new IllegalStateException("WorkQueue " + config.name() + " is shut down");
        }
        if (!task.enqueue(this)) {
            log.debug("Task {} not accepted: state {}", task.getName(), task.getState());
            return false;
        }

        inFlight.add(task);
        task.whenFinished().whenComplete((errors, error) -> release(task));
        schedule(task);
        return true;
    }

    @Override
    public Executor executor() {
        return workers;
    }

    /**
     * 의존성 대기 후 전제조건 평가와 실행을 연결.
     *
     * <p>스케줄링 단계에서 발생한 예외(예: shutdown 이후 거부)는 해당 오류로 Task를 종료시킵니다.</p>
     */
    private void schedule(QueueableTask task) {
        CompletableFuture<?>[] dependencies = task.getDependencies().stream()
            .map(dependency -> dependency.whenFinished().toCompletableFuture())
            .toArray(CompletableFuture<?>[]::new);

        CompletableFuture.anyOf(
                CompletableFuture.allOf(dependencies),
                task.whenCancelled().toCompletableFuture()
            )
            .thenComposeAsync(ignored -> task.evaluatePreconditions(), workers)
            .thenRun(task::start)
            .exceptionally(error -> {
                Throwable cause = unwrap(error);
                log.error("Scheduling of task {} failed", task.getName(), cause);
                task.finish(List.of(TaskError.fromException(cause)));
                return null;
            });
    }

    private void release(QueueableTask task) {
        inFlight.remove(task);
        log.trace("Task {} released ({} in flight)", task.getName(), inFlight.size());
        synchronized (idleLock) {
            if (inFlight.isEmpty()) {
                idleLock.notifyAll();
            }
        }
    }

    /**
     * 진행 중인 Task가 모두 종료될 때까지 대기.
     *
     * @param timeout 최대 대기 시간
     * @param unit 시간 단위
     * @return 제한 시간 내에 비었으면 true
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        synchronized (idleLock) {
            while (!inFlight.isEmpty()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(idleLock, remaining);
            }
            return true;
        }
    }

    /**
     * 제출되었으나 아직 종료되지 않은 Task 수.
     *
     * @return in-flight Task 수
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public WorkQueueConfig getConfig() {
        return config;
    }

    /**
     * 큐 종료 (리소스 정리).
     *
     * <p>새 제출을 거부하고 작업 스레드 풀을 graceful shutdown합니다.
     * {@code shutdownTimeoutMs} 내에 끝나지 않으면 강제 종료합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        shutdown = true;
        workers.shutdown();
        if (!workers.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("WorkQueue {} did not terminate within {}ms, forcing shutdown ({} tasks in flight)",
                config.name(), config.shutdownTimeoutMs(), inFlight.size());
            workers.shutdownNow();
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicLong index = new AtomicLong();

        private WorkerThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
