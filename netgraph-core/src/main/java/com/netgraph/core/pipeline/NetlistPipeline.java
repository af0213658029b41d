package com.netgraph.core.pipeline;

import com.netgraph.core.codec.JsonNetlistCodec;
import com.netgraph.core.config.NetgraphConfig;
import com.netgraph.core.error.ErrorKind;
import com.netgraph.core.error.NetlistException;
import com.netgraph.core.generator.GeneratedArtifact;
import com.netgraph.core.generator.GeneratorConfig;
import com.netgraph.core.generator.NetlistGenerator;
import com.netgraph.core.generator.impl.VerilogGenerator;
import com.netgraph.core.model.Module;
import com.netgraph.core.model.ModuleTemplate;
import com.netgraph.core.model.NetlistResult;
import com.netgraph.core.parser.NetlistParser;
import com.netgraph.core.parser.TemplateExtractor;
import com.netgraph.core.renderer.OutputRenderer;
import com.netgraph.core.validator.InstanceValidator;
import com.netgraph.core.validator.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Orchestrates template extraction, parsing, validation, persistence and regeneration.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * NetlistPipeline pipeline = new NetlistPipeline(ConfigLoader.load(Path.of("netgraph.yaml")));
 * PipelineResult result = pipeline.read(Path.of("top.v"));   // parse, or reuse parsed_objects.json
 * pipeline.write(result.modules());                          // output_netlist_file.v
 * }</pre>
 */
public class NetlistPipeline {

    private static final Logger log = LoggerFactory.getLogger(NetlistPipeline.class);

    private final NetgraphConfig config;
    private final TemplateExtractor extractor;
    private final NetlistParser parser;
    private final JsonNetlistCodec codec;

    public NetlistPipeline(NetgraphConfig config) {
        this(config, new TemplateExtractor(), new NetlistParser(), new JsonNetlistCodec());
    }

    public NetlistPipeline(NetgraphConfig config, TemplateExtractor extractor,
                           NetlistParser parser, JsonNetlistCodec codec) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    public NetgraphConfig config() {
        return config;
    }

    /**
     * Parses a netlist: templates, body pass and, if configured, instance validation.
     *
     * @param netlist netlist source file
     * @return parsed modules with templates and validation results
     * @throws NetlistException on IO failure, unbalanced counts or malformed instance lines
     */
    public PipelineResult parse(Path netlist) throws NetlistException {
        Objects.requireNonNull(netlist, "netlist must not be null");
        log.info("Parsing {}", netlist);

        List<ModuleTemplate> templates = extractor.extract(netlist);
        NetlistResult result = parser.parse(netlist, templates);

        List<ValidationResult> validations = List.of();
        if (config.parser().validateInstances()) {
            validations = new InstanceValidator(templates).validate(result.modules());
        }
        return new PipelineResult(result, templates, validations, false);
    }

    /**
     * Returns the modules of a netlist, reusing the configured JSON exchange file when it
     * exists and reuse is enabled, otherwise parsing and saving the JSON file.
     *
     * @param netlist netlist source file
     * @return modules with their provenance
     * @throws NetlistException on any fatal parse, load or write failure
     */
    public PipelineResult read(Path netlist) throws NetlistException {
        Path json = config.output().jsonPath();
        if (config.parser().reuseJson() && Files.isRegularFile(json)) {
            log.info("Reusing parsed objects from {}", json);
            return new PipelineResult(codec.read(json), List.of(), List.of(), true);
        }

        PipelineResult result = parse(netlist);
        codec.write(result.modules(), json);
        return result;
    }

    /**
     * Loads modules from either a JSON exchange file ({@code .json}) or a netlist source.
     *
     * @param file JSON exchange file or netlist source
     * @return modules with their provenance
     * @throws NetlistException on any fatal parse or load failure
     */
    public PipelineResult load(Path file) throws NetlistException {
        Objects.requireNonNull(file, "file must not be null");
        if (file.getFileName() != null && file.getFileName().toString().endsWith(".json")) {
            return new PipelineResult(codec.read(file), List.of(), List.of(), true);
        }
        return parse(file);
    }

    /**
     * Writes regenerated source for the modules to the configured Verilog file.
     *
     * @param modules modules to regenerate
     * @return path written
     * @throws NetlistException with {@link ErrorKind#IO_ERROR} if the file cannot be written
     */
    public Path write(List<Module> modules) throws NetlistException {
        return write(modules, config.output().verilogPath());
    }

    /**
     * Writes regenerated source for the modules to a file.
     *
     * @param modules modules to regenerate
     * @param target output file, overwritten if present
     * @return path written
     * @throws NetlistException with {@link ErrorKind#IO_ERROR} if the file cannot be written
     */
    public Path write(List<Module> modules, Path target) throws NetlistException {
        GeneratedArtifact artifact = new VerilogGenerator().generate(modules, generatorConfig(Map.of()));
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, artifact.content());
        } catch (IOException e) {
            log.error("Failed to write {}: {}", target, e.getMessage());
            throw new NetlistException(ErrorKind.IO_ERROR, "Failed to write " + target, e);
        }
        log.info("Output written to {}", target);
        return target;
    }

    /**
     * Runs the named generators.
     *
     * @param modules modules to render
     * @param generatorIds generator ids, in order
     * @return one artifact per generator
     * @throws IllegalArgumentException if an id names no registered generator
     */
    public List<GeneratedArtifact> generate(List<Module> modules, List<String> generatorIds) {
        List<GeneratedArtifact> artifacts = new ArrayList<>();
        for (String id : generatorIds) {
            NetlistGenerator generator = findGenerator(id)
                .orElseThrow(() -> new IllegalArgumentException("Unknown generator: " + id));
            log.debug("Running generator {}", generator.getDisplayName());
            Map<String, Object> settings = generator instanceof VerilogGenerator
                ? Map.of(GeneratorConfig.BASE_NAME, baseName(config.output().verilogFile()))
                : Map.of();
            artifacts.add(generator.generate(modules, generatorConfig(settings)));
        }
        return artifacts;
    }

    /**
     * Lists the generators registered through {@link ServiceLoader}.
     *
     * @return available generators
     */
    public static List<NetlistGenerator> availableGenerators() {
        List<NetlistGenerator> generators = new ArrayList<>();
        ServiceLoader.load(NetlistGenerator.class).forEach(generators::add);
        return generators;
    }

    /**
     * Finds a registered generator by id.
     *
     * @param id generator id
     * @return matching generator
     */
    public static Optional<NetlistGenerator> findGenerator(String id) {
        return availableGenerators().stream().filter(g -> g.getId().equals(id)).findFirst();
    }

    /**
     * Lists the renderers registered through {@link ServiceLoader}.
     *
     * @return available renderers
     */
    public static List<OutputRenderer> availableRenderers() {
        List<OutputRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(OutputRenderer.class).forEach(renderers::add);
        return renderers;
    }

    /**
     * Finds a registered renderer by id.
     *
     * @param id renderer id
     * @return matching renderer
     */
    public static Optional<OutputRenderer> findRenderer(String id) {
        return availableRenderers().stream().filter(r -> r.getId().equals(id)).findFirst();
    }

    private GeneratorConfig generatorConfig(Map<String, Object> settings) {
        return new GeneratorConfig(config.generators().headerComment(), settings);
    }

    private static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
