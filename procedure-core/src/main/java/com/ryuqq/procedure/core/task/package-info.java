/**
 * Task state machine.
 *
 * <p>{@link com.ryuqq.procedure.core.task.Task} owns the lifecycle state, the cancellation flag,
 * the accumulated error list and the finish-once guarantee. Everything that calls back into a task
 * from outside its own event queue holds a {@link com.ryuqq.procedure.core.task.TaskReference}
 * rather than the task itself.</p>
 *
 * @since 1.0.0
 * @author Procedure Team
 */
package com.ryuqq.procedure.core.task;
