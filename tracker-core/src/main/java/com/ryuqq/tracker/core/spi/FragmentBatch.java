package com.ryuqq.tracker.core.spi;

import com.ryuqq.tracker.core.model.OutcomeRecord;
import com.ryuqq.tracker.core.model.SuccessRecord;

import java.util.List;

/**
 * Rows collected from one scan of a fragment location.
 *
 * @param successes success rows in fragment-name order
 * @param outcomes outcome rows in fragment-name order
 * @param malformed number of rows skipped because a required column was missing or invalid
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record FragmentBatch(
    List<SuccessRecord> successes,
    List<OutcomeRecord> outcomes,
    int malformed
) {

    public FragmentBatch {
        if (successes == null || outcomes == null) {
            throw new IllegalArgumentException("successes and outcomes cannot be null");
        }
        if (malformed < 0) {
            throw new IllegalArgumentException("malformed must be non-negative (current: " + malformed + ")");
        }
        successes = List.copyOf(successes);
        outcomes = List.copyOf(outcomes);
    }
}
