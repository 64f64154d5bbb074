/**
 * Stage execution result package.
 *
 * <p>This package defines the sealed interface hierarchy returned by every external stage,
 * so that the per-item state machine composes values instead of catching exceptions
 * across stage boundaries.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tracker.core.outcome.StageResult} - Sealed interface (permits Ok, Fail)</li>
 * </ul>
 *
 * <h2>Result Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tracker.core.outcome.Ok} - Stage completed and produced an artifact</li>
 *   <li>{@link com.ryuqq.tracker.core.outcome.Fail} - Stage failed with a step tag</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.tracker.core.outcome;
