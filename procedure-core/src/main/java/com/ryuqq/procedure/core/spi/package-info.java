/**
 * Queue integration SPI.
 *
 * <p>The narrow contract between the task state machine and an external concurrent executor.
 * The queue owns thread assignment and ordering policy; the task owns its lifecycle.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.procedure.core.spi.TaskQueue} - implemented by work queues (see the adapter-runner module)</li>
 *   <li>{@link com.ryuqq.procedure.core.spi.QueueableTask} - readiness signal, completion signal and dependency set exposed by a task</li>
 * </ul>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
package com.ryuqq.procedure.core.spi;
