/**
 * Service Provider Interfaces of the tracker.
 *
 * <h2>Canonical State</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tracker.core.spi.StateStore} - Catalog, SuccessLog and OutcomeLog</li>
 * </ul>
 *
 * <h2>Fragments</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tracker.core.spi.FragmentSink} - Worker-private writes</li>
 *   <li>{@link com.ryuqq.tracker.core.spi.FragmentSource} - Aggregator-side scan</li>
 * </ul>
 *
 * <h2>External Stages</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tracker.core.spi.ExtractionStage} - Protein extraction</li>
 *   <li>{@link com.ryuqq.tracker.core.spi.AnalysisStage} - BUSCO analysis</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.tracker.core.spi;
