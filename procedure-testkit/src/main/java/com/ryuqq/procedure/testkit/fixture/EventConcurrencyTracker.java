package com.ryuqq.procedure.testkit.fixture;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;

/**
 * Records the start and end of lifecycle callbacks and detects overlapping ones.
 *
 * <p>Every tracked callback increments an active counter on entry and decrements it on exit.
 * If the counter is ever observed above one, two callbacks of the same task ran at the same time.
 * An optional per-callback delay widens the window in which an overlap can be caught.</p>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public final class EventConcurrencyTracker {

    /**
     * One tracked callback.
     *
     * @param event callback name
     * @param threadName thread the callback ran on
     * @param startNanos {@link System#nanoTime()} on entry
     * @param endNanos {@link System#nanoTime()} on exit
     */
    public record EventRecord(String event, String threadName, long startNanos, long endNanos) {
    }

    private final Duration callbackDelay;
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger maxActive = new AtomicInteger();
    private final Queue<EventRecord> records = new ConcurrentLinkedQueue<>();

    public EventConcurrencyTracker() {
        this(Duration.ofMillis(1));
    }

    public EventConcurrencyTracker(Duration callbackDelay) {
        if (callbackDelay == null || callbackDelay.isNegative()) {
            throw new IllegalArgumentException("callbackDelay cannot be null or negative");
        }
        this.callbackDelay = callbackDelay;
    }

    /**
     * Runs the block as a tracked callback.
     *
     * @param event callback name
     * @param block callback body
     */
    public void track(String event, Runnable block) {
        long start = System.nanoTime();
        int current = active.incrementAndGet();
        maxActive.accumulateAndGet(current, Math::max);
        try {
            if (!callbackDelay.isZero()) {
                LockSupport.parkNanos(callbackDelay.toNanos());
            }
            block.run();
        } finally {
            active.decrementAndGet();
            records.add(new EventRecord(event, Thread.currentThread().getName(), start, System.nanoTime()));
        }
    }

    public boolean hasConcurrentEvents() {
        return maxActive.get() > 1;
    }

    public int maxConcurrentEvents() {
        return maxActive.get();
    }

    /**
     * Tracked callbacks ordered by start time.
     *
     * @return records (immutable snapshot)
     */
    public List<EventRecord> records() {
        List<EventRecord> snapshot = new ArrayList<>(records);
        snapshot.sort(Comparator.comparingLong(EventRecord::startNanos));
        return List.copyOf(snapshot);
    }

    /**
     * Callback names in start order.
     *
     * @return event names
     */
    public List<String> eventNames() {
        List<String> names = new ArrayList<>();
        for (EventRecord record : records()) {
            names.add(record.event());
        }
        return names;
    }

    @Override
    public String toString() {
        return "EventConcurrencyTracker{max=" + maxActive.get() + ", events=" + eventNames() + '}';
    }
}
