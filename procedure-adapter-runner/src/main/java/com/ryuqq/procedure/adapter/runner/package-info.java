/**
 * Concurrent work queue adapter.
 *
 * <p>{@link com.ryuqq.procedure.adapter.runner.WorkQueue} implements the
 * {@link com.ryuqq.procedure.core.spi.TaskQueue} SPI on a fixed thread pool. It owns thread
 * assignment and holds in-flight tasks alive; the task core owns every state transition.</p>
 *
 * @since 1.0.0
 * @author Procedure Team
 */
package com.ryuqq.procedure.adapter.runner;
