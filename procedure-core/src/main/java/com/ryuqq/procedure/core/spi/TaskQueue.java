package com.ryuqq.procedure.core.spi;

import java.util.Collection;
import java.util.concurrent.Executor;

/**
 * Task를 소비하는 동시 작업 큐 SPI.
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>Thread-safe: 모든 메서드는 여러 스레드에서 동시에 호출될 수 있어야 합니다.</li>
 *   <li>의존성 존중: Task의 의존성이 모두 종료(또는 Task가 취소)된 뒤에 전제조건을 평가해야 합니다.</li>
 *   <li>비블로킹 대기: 다른 Task의 종료를 기다리느라 작업 스레드를 블로킹하지 않아야 합니다.</li>
 *   <li>보유: 제출된 Task는 종료될 때까지 큐가 강한 참조로 보유해야 합니다.</li>
 * </ul>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public interface TaskQueue {

    /**
     * Task 제출 시도.
     *
     * @param task 제출할 Task
     * @return 제출되었으면 true, 이미 제출되었거나 종료된 Task이면 false
     * @throws IllegalArgumentException task가 null인 경우
     * @throws IllegalStateException 큐가 종료된 경우
     */
    boolean offer(QueueableTask task);

    /**
     * Task 제출.
     *
     * @param task 제출할 Task
     * @throws IllegalArgumentException task가 null인 경우
     * @throws IllegalStateException 이미 제출되었거나 종료된 Task, 또는 큐가 종료된 경우
     */
    default void submit(QueueableTask task) {
        if (!offer(task)) {
            throw new IllegalStateException("Task " + task.getName() + " was already submitted (state: " + task.getState() + ")");
        }
    }

    /**
     * 여러 Task 제출.
     *
     * @param tasks 제출할 Task들
     * @throws IllegalArgumentException tasks가 null인 경우
     */
    default void submitAll(Collection<? extends QueueableTask> tasks) {
        if (tasks == null) {
            throw new IllegalArgumentException("tasks cannot be null");
        }
        for (QueueableTask task : tasks) {
            submit(task);
        }
    }

    /**
     * 제출된 Task의 생명주기 이벤트와 실행 본문이 실행될 Executor.
     *
     * @return 작업 스레드 Executor
     */
    Executor executor();
}
