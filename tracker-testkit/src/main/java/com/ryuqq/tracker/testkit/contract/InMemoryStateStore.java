package com.ryuqq.tracker.testkit.contract;

import com.ryuqq.tracker.core.model.AnnotationId;
import com.ryuqq.tracker.core.model.OutcomeKey;
import com.ryuqq.tracker.core.model.OutcomeRecord;
import com.ryuqq.tracker.core.model.StateSnapshot;
import com.ryuqq.tracker.core.model.SuccessRecord;
import com.ryuqq.tracker.core.model.WorkItem;
import com.ryuqq.tracker.core.spi.CatalogNotFoundException;
import com.ryuqq.tracker.core.spi.StateStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory implementation of {@link StateStore} for contract tests.
 *
 * <p>Rows are kept in append order so tests can assert on exact log contents,
 * duplicates included. The store does not dedup on append: that is the aggregator's job.</p>
 *
 * <p><strong>Test Helpers:</strong></p>
 * <ul>
 *   <li>{@link #addCatalogItem(WorkItem)}: register a work item</li>
 *   <li>{@link #setCatalogPresent(boolean)}: simulate a missing catalog</li>
 *   <li>{@link #getSuccessRows()}, {@link #getOutcomeRows()}: inspect canonical logs</li>
 *   <li>{@link #clear()}: reset all state</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryStateStore implements StateStore {

    private final Map<AnnotationId, WorkItem> catalog = new LinkedHashMap<>();
    private final List<SuccessRecord> successRows = new ArrayList<>();
    private final List<OutcomeRecord> outcomeRows = new ArrayList<>();
    private boolean catalogPresent = true;
    private boolean initialized;

    @Override
    public synchronized StateSnapshot snapshot() {
        ensureCatalog();
        Set<AnnotationId> outcomeIds = new HashSet<>();
        for (OutcomeRecord row : outcomeRows) {
            outcomeIds.add(row.id());
        }
        return new StateSnapshot(catalog.keySet(), loadSuccessIds(), outcomeIds);
    }

    @Override
    public synchronized Map<AnnotationId, WorkItem> loadCatalog() {
        ensureCatalog();
        return Collections.unmodifiableMap(new LinkedHashMap<>(catalog));
    }

    @Override
    public synchronized Set<AnnotationId> loadSuccessIds() {
        Set<AnnotationId> ids = new HashSet<>();
        for (SuccessRecord row : successRows) {
            ids.add(row.id());
        }
        return ids;
    }

    @Override
    public synchronized Set<OutcomeKey> loadOutcomeKeys() {
        Set<OutcomeKey> keys = new HashSet<>();
        for (OutcomeRecord row : outcomeRows) {
            keys.add(row.key());
        }
        return keys;
    }

    @Override
    public synchronized void initialize() {
        initialized = true;
    }

    @Override
    public synchronized void appendSuccesses(List<SuccessRecord> records) {
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        successRows.addAll(records);
    }

    @Override
    public synchronized void appendOutcomes(List<OutcomeRecord> records) {
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        outcomeRows.addAll(records);
    }

    /**
     * Registers a work item in the catalog.
     *
     * @param item the work item
     */
    public synchronized void addCatalogItem(WorkItem item) {
        catalog.put(item.id(), item);
    }

    /**
     * Simulates presence or absence of the catalog file.
     *
     * @param present false to make catalog reads fail with {@link CatalogNotFoundException}
     */
    public synchronized void setCatalogPresent(boolean present) {
        this.catalogPresent = present;
    }

    /**
     * Returns a copy of the SuccessLog rows in append order.
     *
     * @return success rows
     */
    public synchronized List<SuccessRecord> getSuccessRows() {
        return List.copyOf(successRows);
    }

    /**
     * Returns a copy of the OutcomeLog rows in append order.
     *
     * @return outcome rows
     */
    public synchronized List<OutcomeRecord> getOutcomeRows() {
        return List.copyOf(outcomeRows);
    }

    /**
     * Returns whether {@link #initialize()} has been called.
     *
     * @return true once the logs were initialized
     */
    public synchronized boolean isInitialized() {
        return initialized;
    }

    /**
     * Clears all stored state.
     */
    public synchronized void clear() {
        catalog.clear();
        successRows.clear();
        outcomeRows.clear();
        catalogPresent = true;
        initialized = false;
    }

    private void ensureCatalog() {
        if (!catalogPresent) {
            throw new CatalogNotFoundException("in-memory");
        }
    }
}
