package com.columncascade;

import ch.qos.logback.classic.Level;
import com.columncascade.cli.CascadeCommand;
import com.columncascade.cli.CleanupCommand;
import com.columncascade.cli.InitCommand;
import com.columncascade.cli.ListCommand;
import com.columncascade.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

/**
 * Main CLI entry point for ColumnCascade.
 *
 * <p>ColumnCascade propagates column metadata through the stages of a data pipeline
 * workbook: landing, bronze, silver, gold, mart and semantic model.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code init} - Create a starter configuration and workbook</li>
 *   <li>{@code cascade} - Derive downstream columns from upstream artifacts</li>
 *   <li>{@code cleanup} - Remove duplicate columns and optionally renumber ids</li>
 *   <li>{@code validate} - Check the workbook invariants</li>
 *   <li>{@code list} - List relation kinds, stages or artifacts</li>
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
 * # Create cascade.yaml and workbook.json
 * column-cascade init
 *
 * # Cascade every artifact, then remove duplicates
 * column-cascade cascade -w workbook.json --cleanup
 *
 * # Cascade one artifact with debug logging
 * column-cascade -v cascade -w workbook.json -a fact_sales_gold
 * }</pre>
 */
@Command(
    name = "column-cascade",
    mixinStandardHelpOptions = true,
    version = "ColumnCascade 1.0.0-SNAPSHOT",
    description = "Column metadata cascading across data pipeline stages",
    subcommands = {
        InitCommand.class,
        CascadeCommand.class,
        CleanupCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class ColumnCascadeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ColumnCascadeCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("ColumnCascade - Column metadata cascading for data pipelines");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'column-cascade --help' to see available commands");
        System.out.println("Use 'column-cascade <command> --help' for command-specific help");
    }

    /**
     * Applies the global options, then runs the most specific command given.
     */
    private int executionStrategy(ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
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

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with the global options wired in.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        ColumnCascadeCLI cli = new ColumnCascadeCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
