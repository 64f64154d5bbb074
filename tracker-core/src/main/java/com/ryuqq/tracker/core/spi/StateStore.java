package com.ryuqq.tracker.core.spi;

import com.ryuqq.tracker.core.model.AnnotationId;
import com.ryuqq.tracker.core.model.OutcomeKey;
import com.ryuqq.tracker.core.model.OutcomeRecord;
import com.ryuqq.tracker.core.model.StateSnapshot;
import com.ryuqq.tracker.core.model.SuccessRecord;
import com.ryuqq.tracker.core.model.WorkItem;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Canonical state SPI over the work catalog and the two append-only logs.
 *
 * <p><strong>Tables:</strong></p>
 * <ul>
 *   <li>WorkCatalog: every work item, created by an external loader, never modified</li>
 *   <li>SuccessLog: at most one row per id</li>
 *   <li>OutcomeLog: one row per attempt, unique on (id, runAt)</li>
 * </ul>
 *
 * <p><strong>Write Discipline:</strong></p>
 * <ul>
 *   <li>Only the aggregator appends, once per cycle, never concurrently with itself</li>
 *   <li>Each row is written completely or not at all</li>
 *   <li>Rows are never updated or removed</li>
 * </ul>
 *
 * <p><strong>Missing Files:</strong> a missing catalog is fatal
 * ({@link CatalogNotFoundException}); missing logs read as empty.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StateStore {

    /**
     * Takes the identifier snapshot used by one dispatch cycle.
     *
     * @return catalog ids, success ids and distinct outcome ids
     * @throws CatalogNotFoundException if the work catalog does not exist
     */
    StateSnapshot snapshot();

    /**
     * Loads every catalog entry with its resource locators.
     *
     * @return work items keyed by id (may be empty)
     * @throws CatalogNotFoundException if the work catalog does not exist
     */
    Map<AnnotationId, WorkItem> loadCatalog();

    /**
     * Loads the dedup keys of the SuccessLog.
     *
     * @return ids with a success row (empty if the log does not exist yet)
     */
    Set<AnnotationId> loadSuccessIds();

    /**
     * Loads the dedup keys of the OutcomeLog.
     *
     * @return (id, runAt) keys (empty if the log does not exist yet)
     */
    Set<OutcomeKey> loadOutcomeKeys();

    /**
     * Creates both logs with their header if they do not exist yet.
     *
     * <p>Existing logs are left untouched.</p>
     */
    void initialize();

    /**
     * Appends rows to the SuccessLog.
     *
     * <p>The caller is responsible for dedup; this method appends what it is given.</p>
     *
     * @param records rows to append (no-op if empty)
     * @throws IllegalArgumentException if records is null
     */
    void appendSuccesses(List<SuccessRecord> records);

    /**
     * Appends rows to the OutcomeLog.
     *
     * @param records rows to append (no-op if empty)
     * @throws IllegalArgumentException if records is null
     */
    void appendOutcomes(List<OutcomeRecord> records);
}
