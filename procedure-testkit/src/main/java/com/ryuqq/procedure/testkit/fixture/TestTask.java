package com.ryuqq.procedure.testkit.fixture;

import com.ryuqq.procedure.core.model.TaskError;
import com.ryuqq.procedure.core.task.Task;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Task that records its executions and finishes on its own.
 *
 * <p>With a zero delay the task finishes inside {@code execute()}; otherwise it finishes
 * from another thread after the delay. When an error is configured it finishes with that error.</p>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public class TestTask extends Task {

    private final Duration delay;
    private final TaskError error;
    private final AtomicInteger executionCount = new AtomicInteger();

    public TestTask() {
        this(null);
    }

    public TestTask(String name) {
        this(name, Duration.ZERO, null);
    }

    /**
     * Constructor.
     *
     * @param name task name (null for a generated one)
     * @param delay time between execution and finish
     * @param error error to finish with (nullable)
     * @throws IllegalArgumentException if delay is null or negative
     */
    public TestTask(String name, Duration delay, TaskError error) {
        super(name);
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay cannot be null or negative");
        }
        this.delay = delay;
        this.error = error;
    }

    @Override
    protected void execute() {
        executionCount.incrementAndGet();
        if (delay.isZero()) {
            finishWithConfiguredError();
            return;
        }
        CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS)
            .execute(this::finishWithConfiguredError);
    }

    private void finishWithConfiguredError() {
        finish(error == null ? List.of() : List.of(error));
    }

    public int getExecutionCount() {
        return executionCount.get();
    }

    public boolean didExecute() {
        return executionCount.get() > 0;
    }
}
