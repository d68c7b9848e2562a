package com.ryuqq.procedure.testkit.fixture;

import com.ryuqq.procedure.core.condition.ConditionResult;
import com.ryuqq.procedure.core.condition.Precondition;
import com.ryuqq.procedure.core.task.TaskReference;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Precondition that completes on another thread after a delay.
 *
 * <p>It records whether its owner was still alive when the result was delivered, which lets
 * tests race the completion against cancellation and teardown of the owner.</p>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public class AsyncCondition extends Precondition {

    private final Duration delay;
    private final ConditionResult result;
    private final AtomicReference<Boolean> ownerAliveOnCompletion = new AtomicReference<>();
    private final CountDownLatch completed = new CountDownLatch(1);

    public AsyncCondition(Duration delay) {
        this(delay, ConditionResult.satisfied());
    }

    /**
     * Constructor.
     *
     * @param delay time before the result is delivered
     * @param result result to deliver
     * @throws IllegalArgumentException if an argument is null or delay is negative
     */
    public AsyncCondition(Duration delay, ConditionResult result) {
        super("AsyncCondition");
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay cannot be null or negative");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        this.delay = delay;
        this.result = result;
    }

    @Override
    protected void evaluate(TaskReference owner, Consumer<ConditionResult> completion) {
        CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
            ownerAliveOnCompletion.set(owner.isAlive());
            completion.accept(result);
            completed.countDown();
        });
    }

    /**
     * Waits for the delayed result to be delivered.
     *
     * @param timeout maximum time to wait
     * @param unit time unit
     * @return true if delivered in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
        return completed.await(timeout, unit);
    }

    /**
     * Owner liveness observed at delivery time.
     *
     * @return null before delivery, otherwise whether the owner was alive
     */
    public Boolean wasOwnerAliveOnCompletion() {
        return ownerAliveOnCompletion.get();
    }
}
