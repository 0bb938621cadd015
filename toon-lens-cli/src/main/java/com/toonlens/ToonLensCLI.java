package com.toonlens;

import ch.qos.logback.classic.Level;
import com.toonlens.cli.DefinitionCommand;
import com.toonlens.cli.FormatCommand;
import com.toonlens.cli.HoverCommand;
import com.toonlens.cli.InspectCommand;
import com.toonlens.cli.ValidateCommand;
import com.toonlens.core.config.ConfigLoader;
import com.toonlens.core.config.ToonConfig;
import com.toonlens.core.service.ToonLanguageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Main CLI entry point for Toon Lens.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code validate} - Report diagnostics for one or more files</li>
 *   <li>{@code format} - Print, check or rewrite a file in canonical form</li>
 *   <li>{@code inspect} - Print the syntax tree of a file as JSON</li>
 *   <li>{@code hover} - Describe the token at a position</li>
 *   <li>{@code definition} - Locate the field a data cell belongs to</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --config} - Configuration file, {@code .toonlens.yaml} by default</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Validate files
 * toonlens validate users.toon orders.toon
 *
 * # Check formatting in CI
 * toonlens format --check users.toon
 *
 * # Describe the token at line 3, column 5 (0-based)
 * toonlens hover users.toon 2 4
 * }</pre>
 */
@Command(
    name = "toonlens",
    mixinStandardHelpOptions = true,
    version = "Toon Lens 1.0.0-SNAPSHOT",
    description = "Validator, formatter and inspector for Toon data files",
    subcommands = {
        ValidateCommand.class,
        FormatCommand.class,
        InspectCommand.class,
        HoverCommand.class,
        DefinitionCommand.class
    }
)
public class ToonLensCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ToonLensCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Option(names = "--config", description = "Configuration file (default: ${DEFAULT-VALUE})",
        defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("Toon Lens - Validator, formatter and inspector for Toon data files");
        System.out.println();
        System.out.println("Use 'toonlens --help' to see available commands");
        System.out.println("Use 'toonlens <command> --help' for command-specific help");
    }

    /**
     * Creates a language service configured from {@code --config}.
     *
     * @return configured service
     */
    public ToonLanguageService createService() {
        ToonConfig config = ConfigLoader.load(configFile);
        return ToonLanguageService.fromConfig(config);
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (!(root instanceof ch.qos.logback.classic.Logger logbackRoot)) {
            log.debug("Logging backend is not Logback; leaving levels unchanged");
            return;
        }
        if (quiet) {
            logbackRoot.setLevel(Level.ERROR);
        } else if (verbose) {
            logbackRoot.setLevel(Level.DEBUG);
        } else {
            logbackRoot.setLevel(Level.WARN);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return ready-to-execute command line
     */
    public static CommandLine commandLine() {
        ToonLensCLI cli = new ToonLensCLI();
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
