package com.ryuqq.procedure.testkit.fixture;

import com.ryuqq.procedure.core.model.TaskError;
import com.ryuqq.procedure.core.observer.TaskObserver;
import com.ryuqq.procedure.core.task.Task;

import java.util.List;
import java.util.function.Consumer;

/**
 * Task whose lifecycle callbacks and execution body are tracked by an {@link EventConcurrencyTracker}.
 *
 * <p>Tracking observers are registered at construction, so they run before any observer
 * a test adds later for the same event.</p>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public class EventConcurrencyTrackingTask extends Task {

    public static final String EXECUTE = "EXECUTE";

    private final Consumer<EventConcurrencyTrackingTask> body;
    private final EventConcurrencyTracker tracker;

    public EventConcurrencyTrackingTask(Consumer<EventConcurrencyTrackingTask> body) {
        this(null, body, new EventConcurrencyTracker());
    }

    /**
     * Constructor.
     *
     * @param name task name (null for a generated one)
     * @param body execution body, responsible for calling finish
     * @param tracker tracker recording the callbacks
     * @throws IllegalArgumentException if body or tracker is null
     */
    public EventConcurrencyTrackingTask(String name, Consumer<EventConcurrencyTrackingTask> body, EventConcurrencyTracker tracker) {
        super(name);
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        if (tracker == null) {
            throw new IllegalArgumentException("tracker cannot be null");
        }
        this.body = body;
        this.tracker = tracker;
        addObserver(new TrackingObserver(tracker));
    }

    @Override
    protected void execute() {
        tracker.track(EXECUTE, () -> body.accept(this));
    }

    public EventConcurrencyTracker getTracker() {
        return tracker;
    }

    private static final class TrackingObserver implements TaskObserver {

        private final EventConcurrencyTracker tracker;

        private TrackingObserver(EventConcurrencyTracker tracker) {
            this.tracker = tracker;
        }

        @Override
        public void willExecute(Task task) {
            tracker.track("WILL_EXECUTE", () -> { });
        }

        @Override
        public void didExecute(Task task) {
            tracker.track("DID_EXECUTE", () -> { });
        }

        @Override
        public void willFinish(Task task, List<TaskError> errors) {
            tracker.track("WILL_FINISH", () -> { });
        }

        @Override
        public void didFinish(Task task, List<TaskError> errors) {
            tracker.track("DID_FINISH", () -> { });
        }

        @Override
        public void didCancel(Task task, List<TaskError> errors) {
            tracker.track("DID_CANCEL", () -> { });
        }
    }
}
