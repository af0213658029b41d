package com.netgraph.cli;

import com.netgraph.core.config.NetgraphConfig;
import com.netgraph.core.error.NetlistException;
import com.netgraph.core.model.Diagnostic;
import com.netgraph.core.model.Module;
import com.netgraph.core.pipeline.NetlistPipeline;
import com.netgraph.core.pipeline.PipelineResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to parse a netlist and save the JSON exchange file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Parse, or reuse parsed_objects.json if present
 * netgraph parse top.v
 *
 * # Always re-parse, and fail on any diagnostic
 * netgraph parse top.v --force --strict
 * }</pre>
 */
@Command(
    name = "parse",
    description = "Parse a netlist and save the parsed objects as JSON",
    mixinStandardHelpOptions = true
)
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private ConfigOptions configOptions;

    @Parameters(index = "0", arity = "0..1", description = "Netlist source (default: input.netlist from config)")
    private Path netlist;

    @Option(names = {"--force"}, description = "Re-parse even if the JSON file already exists")
    private boolean force;

    @Option(names = {"--no-validate"}, description = "Skip instance validation")
    private boolean noValidate;

    @Option(names = {"--strict"}, description = "Fail if any diagnostic was recorded")
    private boolean strict;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            NetgraphConfig config = configOptions.load();
            boolean validate = config.parser().validateInstances() && !noValidate;
            config = config.withParser(validate, config.parser().reuseJson() && !force);
            Path source = netlist != null ? netlist : Path.of(config.input().netlist());

            PipelineResult result = new NetlistPipeline(config).read(source);
            if (result.reloaded()) {
                out.println("✓ Loaded parsed objects from " + config.output().jsonPath());
            } else {
                out.println("✓ Parsed " + source + " (" + result.templates().size() + " module templates)");
                out.println("✓ Saved parsed objects to " + config.output().jsonPath());
            }
            for (Module module : result.modules()) {
                out.printf("  • %s: %d ports, %d nets, %d instances%n", module.name(),
                    module.allPorts().size(), module.nets().size(), module.instances().size());
            }

            List<Diagnostic> diagnostics = result.allDiagnostics();
            diagnostics.forEach(diagnostic -> out.println("  ! " + diagnostic));
            if (strict && !diagnostics.isEmpty()) {
                err.println("✗ " + diagnostics.size() + " diagnostics recorded");
                return 1;
            }
            return 0;
        } catch (NetlistException e) {
            log.error("Parse failed: {}", e.getMessage());
            err.println("✗ Parse failed: " + e.getMessage());
            return 1;
        }
    }
}
