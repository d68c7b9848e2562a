/**
 * Test doubles for tasks and preconditions.
 *
 * <p>Tasks that record their executions, preconditions with fixed, block-driven or delayed outcomes,
 * and instrumentation that detects overlapping lifecycle callbacks.</p>
 *
 * @since 1.0.0
 * @author Procedure Team
 */
package com.ryuqq.procedure.testkit.fixture;
