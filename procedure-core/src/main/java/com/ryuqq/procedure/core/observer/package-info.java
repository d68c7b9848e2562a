/**
 * Observer registry package.
 *
 * <p>Holds the per-task, per-event callback lists and the serial event queue every lifecycle
 * notification of a task runs on.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.procedure.core.observer.ObserverRegistry} - ordered callback handles per {@link com.ryuqq.procedure.core.observer.LifecycleEvent}</li>
 *   <li>{@link com.ryuqq.procedure.core.observer.SerialDispatcher} - non-blocking FIFO event queue, one event at a time per task</li>
 *   <li>{@link com.ryuqq.procedure.core.observer.TaskObserver} - multi-event observer with no-op defaults</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Procedure Team
 */
package com.ryuqq.procedure.core.observer;
