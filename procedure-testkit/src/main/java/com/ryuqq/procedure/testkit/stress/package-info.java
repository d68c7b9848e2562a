/**
 * Stress test harness.
 *
 * <p>Runs a block for every iteration of every batch of a {@link com.ryuqq.procedure.testkit.stress.StressLevel},
 * each batch on its own work queue, and waits until every unit of work entered into the batch has left.</p>
 *
 * @since 1.0.0
 * @author Procedure Team
 */
package com.ryuqq.procedure.testkit.stress;
