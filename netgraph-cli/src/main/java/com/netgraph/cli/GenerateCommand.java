package com.netgraph.cli;

import com.netgraph.core.config.NetgraphConfig;
import com.netgraph.core.error.NetlistException;
import com.netgraph.core.generator.GeneratedArtifact;
import com.netgraph.core.pipeline.NetlistPipeline;
import com.netgraph.core.pipeline.PipelineResult;
import com.netgraph.core.renderer.OutputRenderer;
import com.netgraph.core.renderer.RenderContext;
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
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to run generators over a netlist or a saved JSON exchange file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Regenerate source with the generators enabled in netgraph.yaml
 * netgraph generate top.v
 *
 * # Graph and summary from saved objects, printed to the console
 * netgraph generate parsed_objects.json -t graph -t summary -r console
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate source, graph or summary artifacts from a netlist",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private ConfigOptions configOptions;

    @Parameters(index = "0", arity = "0..1",
        description = "Netlist source or .json exchange file (default: input.netlist from config)")
    private Path input;

    @Option(names = {"-t", "--type"}, description = "Generator id (repeatable; default: generators.enabled)")
    private List<String> types;

    @Option(names = {"-r", "--renderer"}, description = "Renderer id (default: filesystem)")
    private String rendererId = "filesystem";

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            NetgraphConfig config = configOptions.load();
            NetlistPipeline pipeline = new NetlistPipeline(config);
            Path source = input != null ? input : Path.of(config.input().netlist());

            OutputRenderer renderer = NetlistPipeline.findRenderer(rendererId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown renderer: " + rendererId));
            List<String> generatorIds = types != null && !types.isEmpty() ? types : config.generators().enabled();

            PipelineResult result = pipeline.load(source);
            List<GeneratedArtifact> artifacts = pipeline.generate(result.modules(), generatorIds);
            renderer.render(artifacts, new RenderContext(config.output().directory(), Map.of()));

            for (GeneratedArtifact artifact : artifacts) {
                out.println("✓ Generated " + artifact.fileName());
            }
            return 0;
        } catch (NetlistException | IllegalArgumentException | IllegalStateException e) {
            log.error("Generation failed: {}", e.getMessage());
            err.println("✗ Generation failed: " + e.getMessage());
            return 1;
        }
    }
}
