package com.ryuqq.tracker.testkit.contract;

import com.ryuqq.tracker.core.model.AnnotationId;
import com.ryuqq.tracker.core.model.OutcomeRecord;
import com.ryuqq.tracker.core.model.SuccessRecord;
import com.ryuqq.tracker.core.spi.FragmentBatch;
import com.ryuqq.tracker.core.spi.FragmentSink;
import com.ryuqq.tracker.core.spi.FragmentSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * In-memory fragment directory acting as both {@link FragmentSink} and {@link FragmentSource}.
 *
 * <p>Fragments are keyed by {@code <directory>/result_<id>} and {@code <directory>/log_<id>},
 * mirroring the file layout, so a second write for the same id replaces the first exactly
 * as overwriting a file would. {@link #combine(InMemoryFragmentStore...)} merges several
 * worker directories into one source, as the artifact download of a whole cycle does.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryFragmentStore implements FragmentSink, FragmentSource {

    private final String directory;
    private final Map<String, SuccessRecord> successes = new TreeMap<>();
    private final Map<String, OutcomeRecord> outcomes = new TreeMap<>();
    private int malformed;

    /**
     * Creates a fragment store for one worker directory.
     *
     * @param directory directory name used as key prefix (e.g. "chunk-0")
     */
    public InMemoryFragmentStore(String directory) {
        if (directory == null || directory.isBlank()) {
            throw new IllegalArgumentException("directory cannot be null or blank");
        }
        this.directory = directory;
    }

    @Override
    public synchronized void writeSuccess(SuccessRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        successes.put(directory + "/result_" + record.id().getValue(), record);
    }

    @Override
    public synchronized void writeOutcome(OutcomeRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        outcomes.put(directory + "/log_" + record.id().getValue(), record);
    }

    @Override
    public synchronized void discardSuccess(AnnotationId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        successes.remove(directory + "/result_" + id.getValue());
    }

    @Override
    public synchronized FragmentBatch collect() {
        return new FragmentBatch(
            new ArrayList<>(successes.values()),
            new ArrayList<>(outcomes.values()),
            malformed
        );
    }

    /**
     * Simulates fragment rows that a real scan would reject.
     *
     * @param count number of malformed rows to report
     */
    public synchronized void addMalformed(int count) {
        malformed += count;
    }

    /**
     * Returns the number of fragments held (success + outcome).
     *
     * @return fragment count
     */
    public synchronized int size() {
        return successes.size() + outcomes.size();
    }

    /**
     * Returns the keys of all fragments, sorted.
     *
     * @return fragment names
     */
    public synchronized List<String> fragmentNames() {
        List<String> names = new ArrayList<>(successes.keySet());
        names.addAll(outcomes.keySet());
        names.sort(null);
        return names;
    }

    /**
     * Clears all fragments.
     */
    public synchronized void clear() {
        successes.clear();
        outcomes.clear();
        malformed = 0;
    }

    /**
     * Combines several worker directories into one source ordered by fragment name.
     *
     * @param stores worker fragment stores
     * @return a source yielding the rows of every store
     */
    public static FragmentSource combine(InMemoryFragmentStore... stores) {
        return () -> {
            Map<String, SuccessRecord> allSuccesses = new TreeMap<>();
            Map<String, OutcomeRecord> allOutcomes = new TreeMap<>();
            int totalMalformed = 0;
            for (InMemoryFragmentStore store : stores) {
                synchronized (store) {
                    allSuccesses.putAll(store.successes);
                    allOutcomes.putAll(store.outcomes);
                    totalMalformed += store.malformed;
                }
            }
            return new FragmentBatch(
                new ArrayList<>(allSuccesses.values()),
                new ArrayList<>(allOutcomes.values()),
                totalMalformed
            );
        };
    }
}
