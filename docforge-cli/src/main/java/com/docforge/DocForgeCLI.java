package com.docforge;

import com.docforge.cli.BuildCommand;
import com.docforge.cli.CheckVersionsCommand;
import com.docforge.cli.CleanCommand;
import com.docforge.cli.StatusCommand;
import com.docforge.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for DocForge.
 *
 * <p>DocForge syncs source repositories, discovers their public API, generates examples
 * and tests for it, validates the resulting pages and reports the outcome. Builds are
 * incremental: only files whose content (or whose dependencies' content) changed are
 * reprocessed.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code build} - Run an incremental documentation build</li>
 *   <li>{@code status} - List the files the next build would reprocess</li>
 *   <li>{@code validate} - Validate the configuration file</li>
 *   <li>{@code clean} - Remove the workspace and optionally the cache</li>
 *   <li>{@code check-versions} - Check the documented SDKs for new releases</li>
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
 * docforge validate
 * docforge -v build --api-key $KEY
 * docforge clean --cache
 * }</pre>
 */
@Command(
    name = "docforge",
    mixinStandardHelpOptions = true,
    version = "DocForge 1.0.0-SNAPSHOT",
    description = "Incremental API documentation builds with generated, validated examples",
    subcommands = {
        BuildCommand.class,
        StatusCommand.class,
        ValidateCommand.class,
        CleanCommand.class,
        CheckVersionsCommand.class
    }
)
public class DocForgeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DocForgeCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("DocForge - Incremental API Documentation Builds");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'docforge --help' to see available commands");
        System.out.println("Use 'docforge <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
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

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line, applying the global logging options before any
     * subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        DocForgeCLI cli = new DocForgeCLI();
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
