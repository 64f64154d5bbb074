package com.ryuqq.tracker.core.spi;

import com.ryuqq.tracker.core.model.AnnotationId;
import com.ryuqq.tracker.core.model.OutcomeRecord;
import com.ryuqq.tracker.core.model.SuccessRecord;

/**
 * Worker-private fragment output SPI.
 *
 * <p>Each call creates or replaces one fragment whose location is derived
 * deterministically from the record's id, so concurrent workers with disjoint
 * slices never collide. Implementations never touch canonical state.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface FragmentSink {

    /**
     * Writes the success fragment ({@code result_<id>}).
     *
     * @param record the success row
     * @throws IllegalArgumentException if record is null
     * @throws java.io.UncheckedIOException if the fragment cannot be written
     */
    void writeSuccess(SuccessRecord record);

    /**
     * Writes the outcome fragment ({@code log_<id>}).
     *
     * @param record the outcome row
     * @throws IllegalArgumentException if record is null
     * @throws java.io.UncheckedIOException if the fragment cannot be written
     */
    void writeOutcome(OutcomeRecord record);

    /**
     * Removes the success fragment of {@code id}, if one was written.
     *
     * <p>Used when the outcome fragment that should accompany a success cannot be
     * written, so a failed attempt never leaves a success fragment behind.</p>
     *
     * @param id the annotation whose success fragment is dropped
     * @throws IllegalArgumentException if id is null
     * @throws java.io.UncheckedIOException if the fragment exists and cannot be removed
     */
    void discardSuccess(AnnotationId id);
}
