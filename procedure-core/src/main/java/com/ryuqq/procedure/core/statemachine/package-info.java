/**
 * Task state machine package.
 *
 * <p>This package defines the task lifecycle states and the forward-only transition rules
 * every state change is validated against.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.procedure.core.statemachine.TaskState} - Task lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.procedure.core.statemachine.StateTransition} - State transition validation</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * INITIALIZED → PENDING → EVALUATING_PRECONDITIONS → READY → EXECUTING
 * (any state before FINISHING) → FINISHING → FINISHED
 *
 * Forbidden:
 * - FINISHED → * (terminal state)
 * - FINISHING → FINISHING (a second finish is ignored by the task, never attempted)
 * - Backward transitions (e.g., EXECUTING → READY)
 * </pre>
 *
 * @since 1.0.0
 * @author Procedure Team
 */
package com.ryuqq.procedure.core.statemachine;
