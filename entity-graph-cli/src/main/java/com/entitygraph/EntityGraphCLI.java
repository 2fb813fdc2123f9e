package com.entitygraph;

import com.entitygraph.cli.CheckCommand;
import com.entitygraph.cli.DenormalizeCommand;
import com.entitygraph.cli.DiffCommand;
import com.entitygraph.cli.NormalizeCommand;
import com.entitygraph.cli.ValidateCommand;
import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Main CLI entry point for Entity Graph.
 *
 * <p>Works on JSON store files ({@code {"users": {"u1": {...}}}}) and exported schema
 * files (YAML or JSON).
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code check} - Check a store's integrity, optionally repairing it</li>
 *   <li>{@code normalize} - Flatten a nested JSON document into a store</li>
 *   <li>{@code denormalize} - Rebuild nested views of stored entities</li>
 *   <li>{@code diff} - Compare two stores for drift</li>
 *   <li>{@code validate} - Validate a schema file</li>
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
 * # Check a store against the rules in entitygraph.yaml
 * entitygraph check store.json -c entitygraph.yaml
 *
 * # Repair and write the result
 * entitygraph check store.json --repair -o repaired.json
 *
 * # Normalize an API response
 * entitygraph normalize response.json -s schemas.yaml -r posts --array -o store.json
 * }</pre>
 */
@Command(
    name = "entitygraph",
    mixinStandardHelpOptions = true,
    version = "Entity Graph 1.0.0-SNAPSHOT",
    description = "Normalized entity store tooling: integrity checks, repair, drift and schema validation",
    subcommands = {
        CheckCommand.class,
        NormalizeCommand.class,
        DenormalizeCommand.class,
        DiffCommand.class,
        ValidateCommand.class
    }
)
public class EntityGraphCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(EntityGraphCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        spec.commandLine().getOut().println("Entity Graph - normalized entity store tooling");
        spec.commandLine().getOut().println();
        spec.commandLine().getOut().println("Use 'entitygraph --help' to see available commands");
        spec.commandLine().getOut().println("Use 'entitygraph <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options. Runs before any subcommand.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.WARN);
        }
        log.debug("Logging level set to {}", root.getLevel());
    }

    /**
     * Creates the command line with logging configured from the global options before
     * the selected subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        EntityGraphCLI cli = new EntityGraphCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
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
