/**
 * Core domain model package containing the tracker's value objects and records.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tracker.core.model.AnnotationId} - Stable, opaque work item identifier</li>
 *   <li>{@link com.ryuqq.tracker.core.model.WorkItem} - Catalog entry with its two resource locators</li>
 *   <li>{@link com.ryuqq.tracker.core.model.BuscoMetrics} - Parsed analysis metrics</li>
 * </ul>
 *
 * <h2>Canonical Log Rows</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tracker.core.model.SuccessRecord} - One row per id, first success wins</li>
 *   <li>{@link com.ryuqq.tracker.core.model.OutcomeRecord} - One row per attempt, keyed by
 *       {@link com.ryuqq.tracker.core.model.OutcomeKey} (id, runAt)</li>
 * </ul>
 *
 * <h2>Tags</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tracker.core.model.AttemptResult} - success / fail</li>
 *   <li>{@link com.ryuqq.tracker.core.model.FailureStep} - step tag of the stage that ended an attempt</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.tracker.core.model;
