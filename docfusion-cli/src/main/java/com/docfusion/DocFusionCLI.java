package com.docfusion;

import ch.qos.logback.classic.Level;
import com.docfusion.cli.GenerateCommand;
import com.docfusion.cli.PluginsCommand;
import com.docfusion.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for DocFusion.
 *
 * <p>DocFusion analyzes one codebase for several platforms, merges the results into one
 * documentation model and renders it.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Run the documentation pipeline</li>
 *   <li>{@code validate} - Validate a configuration file</li>
 *   <li>{@code plugins} - List installed plugins and their extensions</li>
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
 * # Generate documentation with docfusion.yaml from the current directory
 * docfusion generate
 *
 * # Generate with verbose output into a custom directory
 * docfusion -v generate -o build/api-docs
 *
 * # Check a configuration file
 * docfusion validate docfusion.yaml
 * }</pre>
 */
@Command(
    name = "docfusion",
    mixinStandardHelpOptions = true,
    version = "DocFusion 1.0.0-SNAPSHOT",
    description = "Multi-platform documentation generator",
    subcommands = {
        GenerateCommand.class,
        ValidateCommand.class,
        PluginsCommand.class
    }
)
public class DocFusionCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DocFusionCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("DocFusion - Multi-platform documentation generator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'docfusion --help' to see available commands");
        System.out.println("Use 'docfusion <command> --help' for command-specific help");
    }

    /**
     * Configures the root logging level from the global options.
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
        log.debug("Root log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any command runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        DocFusionCLI cli = new DocFusionCLI();
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
