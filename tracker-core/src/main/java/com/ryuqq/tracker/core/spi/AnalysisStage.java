package com.ryuqq.tracker.core.spi;

import com.ryuqq.tracker.core.model.AnnotationId;
import com.ryuqq.tracker.core.outcome.Fail;
import com.ryuqq.tracker.core.outcome.StageResult;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Stage 2: ortholog completeness analysis of an extracted protein file.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AnalysisStage {

    /**
     * Checks that the analysis tool is installed.
     *
     * @return {@code script_missing} failure, or empty when ready
     */
    Optional<Fail> checkTool();

    /**
     * Runs the analysis against the reference lineage dataset.
     *
     * @param id the item being analyzed (names the output directory)
     * @param proteinFile the stage-1 artifact
     * @return {@code Ok(outputDirectory)}, {@code Fail(lineage_missing)} or {@code Fail(run_busco)}
     */
    StageResult analyze(AnnotationId id, Path proteinFile);
}
