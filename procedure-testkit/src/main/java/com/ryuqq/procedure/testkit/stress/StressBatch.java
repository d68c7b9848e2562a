package com.ryuqq.procedure.testkit.stress;

import com.ryuqq.procedure.adapter.runner.WorkQueue;
import com.ryuqq.procedure.adapter.runner.WorkQueueConfig;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Phaser;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One batch of a stress run.
 *
 * <p>A batch owns its own {@link WorkQueue}, a group of outstanding work and a set of named counters.
 * Each iteration calls {@link #enter()} before submitting work and the work calls {@link #leave()}
 * when it is done; {@link #await(long, TimeUnit)} returns once every entry has left.</p>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public final class StressBatch implements AutoCloseable {

    private final int number;
    private final WorkQueue queue;
    private final Phaser group = new Phaser(1);
    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    public StressBatch(int number) {
        this(number, new WorkQueueConfig().withName("stress-batch-" + number));
    }

    /**
     * Constructor.
     *
     * @param number batch number
     * @param config configuration of the batch queue
     * @throws IllegalArgumentException if config is null
     */
    public StressBatch(int number, WorkQueueConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.number = number;
        this.queue = new WorkQueue(config);
    }

    public int getNumber() {
        return number;
    }

    public WorkQueue getQueue() {
        return queue;
    }

    public void enter() {
        group.register();
    }

    public void leave() {
        group.arriveAndDeregister();
    }

    /**
     * Waits until every entered party has left.
     *
     * @param timeout maximum time to wait
     * @param unit time unit
     * @return true if the group drained in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        try {
            group.awaitAdvanceInterruptibly(group.arrive(), timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        }
    }

    /**
     * Number of entries that have not left yet.
     *
     * @return outstanding entries
     */
    public int outstanding() {
        return group.getRegisteredParties() - 1;
    }

    public long incrementCounter(String name) {
        return counters.computeIfAbsent(name, key -> new AtomicLong()).incrementAndGet();
    }

    public long counter(String name) {
        AtomicLong counter = counters.get(name);
        return counter == null ? 0 : counter.get();
    }

    @Override
    public void close() throws InterruptedException {
        queue.shutdown();
    }

    @Override
    public String toString() {
        return "StressBatch{" + number + ", counters=" + counters + '}';
    }
}
