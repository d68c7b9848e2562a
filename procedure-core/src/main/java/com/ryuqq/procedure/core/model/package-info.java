/**
 * Task value types.
 *
 * <ul>
 *   <li>{@link com.ryuqq.procedure.core.model.TaskId} - validated task identifier</li>
 *   <li>{@link com.ryuqq.procedure.core.model.TaskError} - domain error accumulated by a task</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Procedure Team
 */
package com.ryuqq.procedure.core.model;
