/**
 * Tab-separated file adapter for the tracker SPIs.
 *
 * <p>{@link com.ryuqq.tracker.adapter.tsv.TsvStateStore} reads the work catalog and the
 * two canonical logs and appends to the logs. {@link com.ryuqq.tracker.adapter.tsv.TsvFragmentWriter}
 * writes one worker's private fragments and {@link com.ryuqq.tracker.adapter.tsv.TsvFragmentScanner}
 * collects them back for aggregation.</p>
 *
 * <p>All files are UTF-8, one record per line, fields separated by a single tab.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.tracker.adapter.tsv;
