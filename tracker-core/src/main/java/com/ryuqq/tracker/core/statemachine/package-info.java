/**
 * Per-item attempt state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tracker.core.statemachine.AttemptState} - Attempt lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.tracker.core.statemachine.AttemptStateTransition} - Transition validation</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING → EXTRACTING → ANALYZING → PARSING → SUCCEEDED
 * any non-terminal state → FAILED
 *
 * Forbidden:
 * - SUCCEEDED → * (terminal state)
 * - FAILED → * (terminal state for the current attempt)
 * - Skipping a stage (e.g., EXTRACTING → PARSING)
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.tracker.core.statemachine;
