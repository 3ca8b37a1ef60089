package com.fsmkit;

import com.fsmkit.cli.ChainCommand;
import com.fsmkit.cli.ConvertCommand;
import com.fsmkit.cli.InputType;
import com.fsmkit.cli.ListCommand;
import com.fsmkit.cli.ValidateCommand;
import com.fsmkit.core.config.ConfigLoader;
import com.fsmkit.core.config.FsmKitConfig;
import com.fsmkit.core.exception.FsmSpecException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Main CLI entry point for FsmKit.
 *
 * <p>FsmKit converts finite-state-machine specifications between Mermaid diagrams and the
 * YAML specification format, validates them and chains several of them into one.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code convert} - Convert a spec file to Mermaid or YAML</li>
 *   <li>{@code chain} - Chain several YAML specs into one</li>
 *   <li>{@code validate} - Check a spec against the model invariants</li>
 *   <li>{@code list} - List output formats and input dialects</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all log output except errors</li>
 *   <li>{@code -c, --config} - Configuration file (default: fsmkit.yaml)</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Render a state diagram as a YAML spec
 * fsmkit convert trader.mmd TraderAbciApp --output fsm-spec
 *
 * # Chain two specs
 * fsmkit chain registration.yaml trader.yaml --label TraderChainedAbciApp
 * }</pre>
 */
@Command(
    name = "fsmkit",
    mixinStandardHelpOptions = true,
    version = "FsmKit 1.0.0-SNAPSHOT",
    description = "Finite-state-machine specification compiler",
    subcommands = {
        ConvertCommand.class,
        ChainCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class FsmKitCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(FsmKitCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all log output except errors")
    private boolean quiet;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ${DEFAULT-VALUE})")
    private Path configFile = Paths.get(ConfigLoader.DEFAULT_CONFIG_FILE);

    private FsmKitConfig config;

    @Override
    public void run() {
        System.out.println("FsmKit - Finite-state-machine specification compiler");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'fsmkit --help' to see available commands");
        System.out.println("Use 'fsmkit <command> --help' for command-specific help");
    }

    /**
     * Returns the loaded configuration, reading it on first use.
     *
     * @return configuration from {@code --config} or defaults
     */
    public FsmKitConfig getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
        }
        return config;
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
    }

    private int executionStrategy(ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Reports core failures as a single error line instead of a stack trace.
     */
    private static int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) {
        if (ex instanceof FsmSpecException || ex instanceof IOException || ex instanceof UncheckedIOException) {
            log.debug("Command failed", ex);
            commandLine.getErr().println(commandLine.getColorScheme().errorText("Error: " + ex.getMessage()));
            return 1;
        }
        log.error("Unexpected failure", ex);
        commandLine.getErr().println(commandLine.getColorScheme().errorText("Error: " + ex));
        return 1;
    }

    // accepts "fsm-spec" as well as "FSM_SPEC"
    private static InputType toInputType(String value) {
        return InputType.valueOf(value.strip().toUpperCase(Locale.ROOT).replace('-', '_'));
    }

    /**
     * Creates a configured command line for this application.
     *
     * @return command line ready to execute
     */
    public static CommandLine newCommandLine() {
        FsmKitCLI cli = new FsmKitCLI();
        return new CommandLine(cli)
            .registerConverter(InputType.class, FsmKitCLI::toInputType)
            .setExecutionStrategy(cli::executionStrategy)
            .setExecutionExceptionHandler(FsmKitCLI::handleExecutionException);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }
}
