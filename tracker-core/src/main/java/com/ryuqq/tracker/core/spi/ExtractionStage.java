package com.ryuqq.tracker.core.spi;

import com.ryuqq.tracker.core.model.WorkItem;
import com.ryuqq.tracker.core.outcome.Fail;
import com.ryuqq.tracker.core.outcome.StageResult;

import java.util.Optional;

/**
 * Stage 1: protein extraction from an annotation and its assembly.
 *
 * <p>Implementations block until the external extraction finishes and never throw
 * for anticipated failures; they return {@link com.ryuqq.tracker.core.outcome.Fail}
 * with {@code extract_proteins} instead.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ExtractionStage {

    /**
     * Checks that the extraction tool is installed.
     *
     * @return {@code script_missing} failure, or empty when ready
     */
    Optional<Fail> checkTool();

    /**
     * Checks that both input files of the item are reachable.
     *
     * @param item the work item
     * @return {@code input_missing} failure, or empty when both inputs exist
     */
    Optional<Fail> checkInputs(WorkItem item);

    /**
     * Runs the extraction.
     *
     * @param item the work item
     * @return {@code Ok(proteinFile)} or {@code Fail(extract_proteins)}
     */
    StageResult extract(WorkItem item);
}
