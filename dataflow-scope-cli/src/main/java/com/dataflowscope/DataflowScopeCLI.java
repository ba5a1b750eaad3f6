package com.dataflowscope;

import com.dataflowscope.cli.ExtractCommand;
import com.dataflowscope.cli.ListCommand;
import com.dataflowscope.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for Dataflow Scope.
 *
 * <p>Dataflow Scope turns the operator chains found in a dataflow program into a graph with
 * location and code hierarchies, ready for a hierarchical graph viewer.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code extract} - Build the graph JSON from an extractor request</li>
 *   <li>{@code validate} - Check a graph JSON file for structural problems</li>
 *   <li>{@code list} - List the operator catalogue or node types</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Build a graph and write it next to the request
 * dataflow-scope extract request.json -o graph.json
 *
 * # Same, with debug logging and a custom operator catalogue
 * dataflow-scope -v extract request.json -c dataflowscope.yaml
 *
 * # Check a graph produced elsewhere
 * dataflow-scope validate graph.json
 * }</pre>
 */
@Command(
    name = "dataflow-scope",
    mixinStandardHelpOptions = true,
    version = "Dataflow Scope 1.0.0-SNAPSHOT",
    description = "Dataflow graph construction and hierarchical clustering for operator chains",
    subcommands = {
        ExtractCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class DataflowScopeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DataflowScopeCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("Dataflow Scope - Dataflow graph construction and clustering");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'dataflow-scope --help' to see available commands");
        System.out.println("Use 'dataflow-scope <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    /**
     * Applies the global options, then runs the most specific command given.
     *
     * @param parseResult parsed command line
     * @return exit code
     */
    private int executionStrategy(CommandLine.ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with global options applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        DataflowScopeCLI cli = new DataflowScopeCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
