package com.ryuqq.tracker.core.spi;

/**
 * Fragment discovery SPI used by the aggregator.
 *
 * <p>Implementations scan every fragment produced by the workers of a cycle and
 * return their rows in a deterministic order (sorted by fragment name).
 * Rows missing a required column are counted as malformed and left out.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface FragmentSource {

    /**
     * Collects all fragment rows.
     *
     * @return success rows, outcome rows and the malformed row count
     * @throws java.io.UncheckedIOException if the fragment location cannot be scanned
     */
    FragmentBatch collect();
}
