package com.netgraph;

import ch.qos.logback.classic.Level;
import com.netgraph.cli.DiffCommand;
import com.netgraph.cli.GenerateCommand;
import com.netgraph.cli.ListCommand;
import com.netgraph.cli.ParseCommand;
import com.netgraph.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Main CLI entry point for netgraph.
 *
 * <p>netgraph parses structural gate-level netlists into a module graph, saves it as
 * JSON and regenerates source text from it.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code parse} - Parse a netlist and save the JSON exchange file</li>
 *   <li>{@code generate} - Run generators (verilog, graph, summary) over a netlist</li>
 *   <li>{@code validate} - Check instance pins against module port lists</li>
 *   <li>{@code diff} - Compare two netlists structurally, or check a round trip</li>
 *   <li>{@code list} - List generators, renderers or the modules of a netlist</li>
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
 * netgraph parse top.v
 * netgraph -v generate top.v -t verilog -t summary -o build
 * netgraph diff top.v
 * }</pre>
 */
@Command(
    name = "netgraph",
    mixinStandardHelpOptions = true,
    version = "netgraph 1.0.0-SNAPSHOT",
    description = "Gate-level netlist parser, JSON codec and source regenerator",
    subcommands = {
        ParseCommand.class,
        GenerateCommand.class,
        ValidateCommand.class,
        DiffCommand.class,
        ListCommand.class
    }
)
public class NetgraphCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(NetgraphCLI.class);

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
        spec.commandLine().getOut().println("netgraph - Gate-level netlist parser");
        spec.commandLine().getOut().println("Use 'netgraph --help' to see available commands");
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
        log.debug("Root log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        NetgraphCLI cli = new NetgraphCLI();
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
