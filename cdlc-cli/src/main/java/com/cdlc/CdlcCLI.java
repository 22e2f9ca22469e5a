package com.cdlc;

import ch.qos.logback.classic.Level;
import com.cdlc.cli.ExportCommand;
import com.cdlc.cli.ListCommand;
import com.cdlc.cli.TagsCommand;
import com.cdlc.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for the CDL compiler.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code validate} - Compile and validate composite blocks</li>
 *   <li>{@code export} - Write a compiled block, or its flattened form, as JSON</li>
 *   <li>{@code tags} - Show the Brick and Haystack tags of a block</li>
 *   <li>{@code list} - List catalog blocks, enumerations or library composites</li>
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
 * # Validate a block of the library configured in cdlc.yaml
 * cdlc validate MyLib.Controls.Sequence
 *
 * # Validate a file
 * cdlc -v validate library/MyLib/Controls/Sequence.mo
 *
 * # Export the flattened block diagram
 * cdlc export MyLib.Controls.Sequence --flat -o sequence.json
 * }</pre>
 */
@Command(
    name = "cdlc",
    mixinStandardHelpOptions = true,
    version = "cdlc 1.0.0-SNAPSHOT",
    description = "Compiler and validator for Control Description Language block diagrams",
    subcommands = {
        ValidateCommand.class,
        ExportCommand.class,
        TagsCommand.class,
        ListCommand.class
    }
)
public class CdlcCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CdlcCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("cdlc - Control Description Language compiler");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'cdlc --help' to see available commands");
        System.out.println("Use 'cdlc <command> --help' for command-specific help");
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
        log.debug("Verbose logging enabled");
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with global options applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        CdlcCLI cli = new CdlcCLI();
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
