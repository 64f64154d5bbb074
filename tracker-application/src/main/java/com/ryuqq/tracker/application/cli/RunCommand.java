package com.ryuqq.tracker.application.cli;

import com.ryuqq.tracker.adapter.runner.BuscoAnalysisStage;
import com.ryuqq.tracker.adapter.runner.BuscoSummaryParser;
import com.ryuqq.tracker.adapter.runner.ChunkReport;
import com.ryuqq.tracker.adapter.runner.ChunkWorkerRunner;
import com.ryuqq.tracker.adapter.runner.ProcessStageRunner;
import com.ryuqq.tracker.adapter.runner.ScriptExtractionStage;
import com.ryuqq.tracker.adapter.runner.WorkerConfig;
import com.ryuqq.tracker.adapter.runner.WorkerExecutor;
import com.ryuqq.tracker.adapter.tsv.TsvFragmentWriter;
import com.ryuqq.tracker.adapter.tsv.TsvStateStore;
import com.ryuqq.tracker.core.partition.ChunkPartitioner;
import com.ryuqq.tracker.core.partition.PartitionConfig;
import com.ryuqq.tracker.core.pending.PendingSetResolver;
import com.ryuqq.tracker.core.spi.CatalogNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Processes one worker's stride slice and writes its private fragments.
 *
 * <p>Per-item failures are recorded as outcome fragments and never change the exit code.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@Command(
    name = RunCommand.NAME,
    mixinStandardHelpOptions = true,
    description = "Runs the pending slice pending[K], pending[K+N], ... of chunk K out of N.")
class RunCommand implements Callable<Integer> {

    static final String NAME = "run";

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "CATALOG", description = "Work catalog (annotations.tsv)")
    private Path catalog;

    @Parameters(index = "1", paramLabel = "SUCCESS_LOG", description = "Success log (BUSCO.tsv)")
    private Path successLog;

    @Parameters(index = "2", paramLabel = "OUTCOME_LOG", description = "Outcome log (log.tsv)")
    private Path outcomeLog;

    @Parameters(index = "3", paramLabel = "K", description = "Index of this chunk (0-based)")
    private int chunkIndex;

    @Parameters(index = "4", paramLabel = "N", description = "Total number of chunks")
    private int chunkCount;

    @Parameters(index = "5", paramLabel = "OUTPUT_DIR", description = "Directory for result and log fragments")
    private Path outputDir;

    @Parameters(index = "6", arity = "0..1", paramLabel = "B", defaultValue = "0",
        description = "Cap on annotations processed by this chunk (0 = no cap)")
    private int maxPerJob;

    @Option(names = "--scripts-dir", paramLabel = "DIR", defaultValue = "scripts",
        description = "Directory holding 01_extract_proteins.sh and 02_run_BUSCO.sh (default: ${DEFAULT-VALUE})")
    private Path scriptsDir;

    @Option(names = "--work-dir", paramLabel = "DIR", defaultValue = ".",
        description = "Working directory for external tools and relative input paths (default: ${DEFAULT-VALUE})")
    private Path workDir;

    @Option(names = "--lineage", paramLabel = "DIR",
        description = "Lineage dataset candidate, repeatable, first existing wins")
    private List<Path> lineages;

    @Option(names = "--stage-timeout", paramLabel = "DURATION",
        description = "Kill an external stage after this long, ISO-8601 (e.g. PT2H); no limit by default")
    private Duration stageTimeout;

    @Override
    public Integer call() {
        if (chunkCount <= 0) {
            throw new ParameterException(spec.commandLine(), "N must be positive: " + chunkCount);
        }
        if (chunkIndex < 0 || chunkIndex >= chunkCount) {
            throw new ParameterException(spec.commandLine(),
                "K must be in [0, " + chunkCount + "): " + chunkIndex);
        }
        if (maxPerJob < 0) {
            throw new ParameterException(spec.commandLine(), "B must be non-negative: " + maxPerJob);
        }

        WorkerConfig config = new WorkerConfig()
            .withScriptsDir(scriptsDir)
            .withWorkDir(workDir)
            .withStageTimeout(stageTimeout);
        if (lineages != null && !lineages.isEmpty()) {
            config = config.withLineageCandidates(lineages);
        }

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            log.error("Cannot create output directory {}: {}", outputDir, e.getMessage());
            return TrackerCommand.EXIT_ERROR;
        }

        ProcessStageRunner processRunner = new ProcessStageRunner(config);
        WorkerExecutor executor = new WorkerExecutor(
            new ScriptExtractionStage(config, processRunner),
            new BuscoAnalysisStage(config, processRunner),
            new BuscoSummaryParser(),
            new TsvFragmentWriter(outputDir)
        );
        ChunkWorkerRunner runner = new ChunkWorkerRunner(
            new TsvStateStore(catalog, successLog, outcomeLog),
            new PendingSetResolver(),
            new ChunkPartitioner(new PartitionConfig().withMaxPerJob(maxPerJob)),
            executor
        );

        try {
            ChunkReport report = runner.run(chunkIndex, chunkCount);
            if (report.skipped() > 0) {
                log.warn("{} ids had no catalog entry and were skipped", report.skipped());
            }
        } catch (CatalogNotFoundException e) {
            log.error("Work catalog not found: {}", e.getLocation());
            return TrackerCommand.EXIT_ERROR;
        } catch (UncheckedIOException e) {
            log.error("Failed to read tracker state: {}", e.getMessage());
            return TrackerCommand.EXIT_ERROR;
        }
        return TrackerCommand.EXIT_OK;
    }
}
