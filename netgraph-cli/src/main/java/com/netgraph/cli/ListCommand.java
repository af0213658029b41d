package com.netgraph.cli;

import com.netgraph.core.error.NetlistException;
import com.netgraph.core.generator.NetlistGenerator;
import com.netgraph.core.model.Instance;
import com.netgraph.core.model.Module;
import com.netgraph.core.pipeline.NetlistPipeline;
import com.netgraph.core.renderer.OutputRenderer;
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
 * Command to list available generators, renderers, or the modules of a netlist.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * netgraph list generators
 * netgraph list modules -i top.v
 * }</pre>
 */
@Command(
    name = "list",
    description = "List generators, renderers, or modules of a netlist",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private ConfigOptions configOptions;

    @Parameters(
        index = "0",
        description = "What to list: generators, renderers, modules",
        defaultValue = "generators"
    )
    private String category;

    @Option(names = {"-i", "--input"}, description = "Netlist or .json file (for 'modules')")
    private Path input;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        switch (category) {
            case "generators" -> listGenerators(out);
            case "renderers" -> listRenderers(out);
            case "modules" -> {
                return listModules(out, err);
            }
            default -> {
                err.println("✗ Unknown category: " + category + " (expected generators, renderers, modules)");
                return 2;
            }
        }
        return 0;
    }

    private void listGenerators(PrintWriter out) {
        out.println("Available Generators:");
        List<NetlistGenerator> generators = NetlistPipeline.availableGenerators();
        for (NetlistGenerator generator : generators) {
            out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            out.printf("    File Extension: .%s%n", generator.getFileExtension());
        }
        if (generators.isEmpty()) {
            out.println("  No generators found.");
        }
    }

    private void listRenderers(PrintWriter out) {
        out.println("Available Renderers:");
        List<OutputRenderer> renderers = NetlistPipeline.availableRenderers();
        for (OutputRenderer renderer : renderers) {
            out.printf("  • %s%n", renderer.getId());
        }
        if (renderers.isEmpty()) {
            out.println("  No renderers found.");
        }
    }

    private int listModules(PrintWriter out, PrintWriter err) {
        try {
            NetlistPipeline pipeline = new NetlistPipeline(configOptions.load().withParser(false, false));
            Path source = input != null ? input : Path.of(pipeline.config().input().netlist());
            List<Module> modules = pipeline.load(source).modules();

            out.println("Modules in " + source + ":");
            for (Module module : modules) {
                out.printf("  • %s (%d inputs, %d outputs)%n", module.name(),
                    module.inputs().size(), module.outputs().size());
                for (Instance instance : module.instances()) {
                    out.printf("    %s %s [%s]%n", instance.refName(), instance.name(), instance.cellType().tag());
                }
            }
            return 0;
        } catch (NetlistException e) {
            log.error("Listing modules failed: {}", e.getMessage());
            err.println("✗ Listing modules failed: " + e.getMessage());
            return 1;
        }
    }
}
