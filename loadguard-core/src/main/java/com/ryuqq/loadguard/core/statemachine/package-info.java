/**
 * Task state machine package.
 *
 * <p>This package implements the one-directional lifecycle of a deferred task.</p>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING → RUNNING (worker picked it up)
 * PENDING → FAILED (cancelled or executor shut down before start)
 * RUNNING → SUCCEEDED
 * RUNNING → FAILED
 *
 * Forbidden:
 * - SUCCEEDED → * (terminal state)
 * - FAILED → * (terminal state)
 * - Backward transitions (e.g., RUNNING → PENDING)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * TaskState state = TaskState.PENDING;
 * state = TaskStateTransition.transition(state, TaskState.RUNNING);
 * state = TaskStateTransition.transition(state, TaskState.SUCCEEDED);
 *
 * // This will throw IllegalStateException
 * TaskStateTransition.validate(state, TaskState.RUNNING);
 * </pre>
 *
 * @since 1.0.0
 * @author LoadGuard Team
 */
package com.ryuqq.loadguard.core.statemachine;
