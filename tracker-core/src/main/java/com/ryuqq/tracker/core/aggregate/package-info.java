/**
 * Idempotent merge of worker fragments into the canonical logs.
 *
 * <ul>
 *   <li>{@link com.ryuqq.tracker.core.aggregate.FragmentAggregator} - Dedup and append</li>
 *   <li>{@link com.ryuqq.tracker.core.aggregate.AggregationReport} - Counts of one pass</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.tracker.core.aggregate;
