package com.ryuqq.tracker.application.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;

import java.io.PrintStream;
import java.util.Map;

/**
 * Batch tracker command line.
 *
 * <p>One cycle runs {@code plan} once, {@code run} once per chunk (in parallel, on
 * separate machines), then {@code aggregate} once.</p>
 *
 * <pre>
 * tracker plan      annotations.tsv BUSCO.tsv log.tsv [--max-chunks N] [--max-per-job B]
 * tracker run       annotations.tsv BUSCO.tsv log.tsv K N out/ [B]
 * tracker aggregate artifacts/ BUSCO.tsv log.tsv
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@Command(
    name = "tracker",
    mixinStandardHelpOptions = true,
    version = "tracker 1.0.0",
    description = "Pending-set dispatch and idempotent aggregation for batch BUSCO runs.",
    subcommands = {
        HelpCommand.class,
        PlanCommand.class,
        RunCommand.class,
        AggregateCommand.class,
    })
public class TrackerCommand {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;

    private final Map<String, String> environment;
    private final PrintStream out;

    public TrackerCommand() {
        this(System.getenv(), System.out);
    }

    /**
     * Creates a command with an explicit environment and output stream.
     *
     * @param environment environment variables ({@code GITHUB_OUTPUT} is read from here)
     * @param out stream for plan output when no output file is configured
     */
    public TrackerCommand(Map<String, String> environment, PrintStream out) {
        if (environment == null || out == null) {
            throw new IllegalArgumentException("environment and out cannot be null");
        }
        this.environment = environment;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TrackerCommand()).execute(args);
        System.exit(exitCode);
    }

    Map<String, String> getEnvironment() {
        return environment;
    }

    PrintStream getOut() {
        return out;
    }
}
