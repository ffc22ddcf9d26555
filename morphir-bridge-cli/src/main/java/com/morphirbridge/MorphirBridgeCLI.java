package com.morphirbridge;

import ch.qos.logback.classic.Level;
import com.morphirbridge.cli.InfoCommand;
import com.morphirbridge.cli.MigrateCommand;
import com.morphirbridge.cli.VisitCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for Morphir Bridge.
 *
 * <p>Morphir Bridge reads Morphir IR in the classic (V1, V2, V3) and V4 formats, migrates it
 * between them and runs analyses over it.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code info} - Detect the format of an IR file or tree and summarize it</li>
 *   <li>{@code migrate} - Convert IR to another format version</li>
 *   <li>{@code visit} - Run a built-in analysis over IR</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Migrate classic IR to a V4 document tree
 * morphir-bridge migrate morphir-ir.json --target latest -o .morphir-dist
 *
 * # Count modules
 * morphir-bridge visit .morphir-dist --analysis modules
 * }</pre>
 */
@Command(
    name = "morphir-bridge",
    mixinStandardHelpOptions = true,
    version = "Morphir Bridge 1.0.0-SNAPSHOT",
    description = "Reads, migrates and analyzes Morphir IR across format versions",
    subcommands = {
        InfoCommand.class,
        MigrateCommand.class,
        VisitCommand.class
    }
)
public class MorphirBridgeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MorphirBridgeCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("Morphir Bridge - Morphir IR reader and migrator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'morphir-bridge --help' to see available commands");
    }

    /**
     * Sets the root log level from the global options. Runs before any subcommand.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Builds the command line with logging configured ahead of whichever command runs.
     */
    public static CommandLine commandLine() {
        MorphirBridgeCLI cli = new MorphirBridgeCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
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
