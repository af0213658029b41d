package com.netgraph.cli;

import com.netgraph.core.compare.NetlistComparator;
import com.netgraph.core.compare.StructuralDiff;
import com.netgraph.core.config.NetgraphConfig;
import com.netgraph.core.error.NetlistException;
import com.netgraph.core.generator.GeneratorConfig;
import com.netgraph.core.generator.impl.VerilogGenerator;
import com.netgraph.core.model.Module;
import com.netgraph.core.model.NetlistResult;
import com.netgraph.core.parser.NetlistParser;
import com.netgraph.core.parser.TemplateExtractor;
import com.netgraph.core.pipeline.NetlistPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to compare netlists structurally.
 *
 * <p>With two inputs (netlist sources or {@code .json} exchange files) the two module
 * lists are compared. With one netlist source, its regenerated source is re-parsed and
 * compared against the original parse.
 */
@Command(
    name = "diff",
    description = "Compare two netlists, or check that one survives regeneration",
    mixinStandardHelpOptions = true
)
public class DiffCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DiffCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private ConfigOptions configOptions;

    @Parameters(index = "0", description = "Reference netlist or .json file")
    private Path left;

    @Parameters(index = "1", arity = "0..1", description = "Netlist or .json file to compare (default: round trip)")
    private Path right;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            NetgraphConfig config = configOptions.load().withParser(false, false);
            NetlistPipeline pipeline = new NetlistPipeline(config);

            List<Module> reference = pipeline.load(left).modules();
            List<Module> candidate = right != null ? pipeline.load(right).modules() : roundTrip(reference);

            StructuralDiff diff = new NetlistComparator().compare(reference, candidate);
            if (diff.isEquivalent()) {
                out.println("✓ No structural differences");
                return 0;
            }
            diff.differences().forEach(difference -> out.println("  - " + difference));
            err.println("✗ " + diff.differences().size() + " structural differences");
            return 1;
        } catch (NetlistException e) {
            log.error("Diff failed: {}", e.getMessage());
            err.println("✗ Diff failed: " + e.getMessage());
            return 1;
        }
    }

    private List<Module> roundTrip(List<Module> modules) throws NetlistException {
        String source = new VerilogGenerator().generate(modules, GeneratorConfig.defaults()).content();
        NetlistResult reparsed = new NetlistParser().parseSource(source, new TemplateExtractor().extractSource(source));
        return reparsed.modules();
    }
}
