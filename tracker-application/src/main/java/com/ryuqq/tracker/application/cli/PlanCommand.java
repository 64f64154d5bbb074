package com.ryuqq.tracker.application.cli;

import com.ryuqq.tracker.adapter.tsv.TsvStateStore;
import com.ryuqq.tracker.application.cycle.DispatchPlanner;
import com.ryuqq.tracker.application.cycle.GithubOutputWriter;
import com.ryuqq.tracker.core.partition.ChunkPartitioner;
import com.ryuqq.tracker.core.partition.DispatchPlan;
import com.ryuqq.tracker.core.partition.PartitionConfig;
import com.ryuqq.tracker.core.pending.PendingSetResolver;
import com.ryuqq.tracker.core.spi.CatalogNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Computes the pending set and emits the worker matrix.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@Command(
    name = PlanCommand.NAME,
    mixinStandardHelpOptions = true,
    description = {
        "Computes pending annotations and writes matrix, chunk_count and pending_count",
        "to the file named by $GITHUB_OUTPUT, or to stdout when it is not set."
    })
class PlanCommand implements Callable<Integer> {

    static final String NAME = "plan";

    private static final Logger log = LoggerFactory.getLogger(PlanCommand.class);

    @ParentCommand
    private TrackerCommand parent;

    @Parameters(index = "0", paramLabel = "CATALOG", description = "Work catalog (annotations.tsv)")
    private Path catalog;

    @Parameters(index = "1", paramLabel = "SUCCESS_LOG", description = "Success log (BUSCO.tsv)")
    private Path successLog;

    @Parameters(index = "2", paramLabel = "OUTCOME_LOG", description = "Outcome log (log.tsv)")
    private Path outcomeLog;

    @Option(names = "--max-chunks", paramLabel = "N", defaultValue = "256",
        description = "Maximum number of matrix chunks (default: ${DEFAULT-VALUE})")
    private int maxChunks;

    @Option(names = "--max-per-job", paramLabel = "B", defaultValue = "0",
        description = "Maximum annotations per chunk; limits the total processed per cycle (0 = no limit)")
    private int maxPerJob;

    @Override
    public Integer call() {
        PartitionConfig config = new PartitionConfig(maxChunks, maxPerJob);
        DispatchPlanner planner = new DispatchPlanner(
            new TsvStateStore(catalog, successLog, outcomeLog),
            new PendingSetResolver(),
            new ChunkPartitioner(config)
        );

        DispatchPlan plan;
        try {
            plan = planner.plan();
        } catch (CatalogNotFoundException e) {
            log.error("Work catalog not found: {}", e.getLocation());
            return TrackerCommand.EXIT_ERROR;
        } catch (UncheckedIOException e) {
            log.error("Failed to read tracker state: {}", e.getMessage());
            return TrackerCommand.EXIT_ERROR;
        }

        GithubOutputWriter.fromEnvironment(parent.getEnvironment(), parent.getOut()).write(plan);
        return TrackerCommand.EXIT_OK;
    }
}
