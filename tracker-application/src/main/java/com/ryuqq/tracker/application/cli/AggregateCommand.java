package com.ryuqq.tracker.application.cli;

import com.ryuqq.tracker.adapter.tsv.TsvFragmentScanner;
import com.ryuqq.tracker.adapter.tsv.TsvStateStore;
import com.ryuqq.tracker.core.aggregate.AggregationReport;
import com.ryuqq.tracker.core.aggregate.FragmentAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Merges every worker fragment under an artifacts directory into the canonical logs.
 *
 * <p>Safe to run again on the same artifacts: rows already present are skipped.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@Command(
    name = AggregateCommand.NAME,
    mixinStandardHelpOptions = true,
    description = "Appends new result_*.tsv and log_*.tsv rows to the canonical logs, skipping duplicates.")
class AggregateCommand implements Callable<Integer> {

    static final String NAME = "aggregate";

    private static final Logger log = LoggerFactory.getLogger(AggregateCommand.class);

    @Parameters(index = "0", paramLabel = "ARTIFACTS_DIR", description = "Root directory of downloaded worker fragments")
    private Path artifactsDir;

    @Parameters(index = "1", paramLabel = "SUCCESS_LOG", description = "Success log (BUSCO.tsv)")
    private Path successLog;

    @Parameters(index = "2", paramLabel = "OUTCOME_LOG", description = "Outcome log (log.tsv)")
    private Path outcomeLog;

    @Override
    public Integer call() {
        if (!Files.isDirectory(artifactsDir)) {
            log.error("Artifacts directory not found: {}", artifactsDir);
            return TrackerCommand.EXIT_ERROR;
        }

        TsvStateStore store = TsvStateStore.logsOnly(successLog, outcomeLog);
        FragmentAggregator aggregator = new FragmentAggregator(store, new TsvFragmentScanner(artifactsDir));

        try {
            AggregationReport report = aggregator.aggregate();
            if (report.malformed() > 0) {
                log.warn("{} fragment rows were malformed and not merged", report.malformed());
            }
        } catch (UncheckedIOException e) {
            log.error("Aggregation failed: {}", e.getMessage());
            return TrackerCommand.EXIT_ERROR;
        }
        return TrackerCommand.EXIT_OK;
    }
}
