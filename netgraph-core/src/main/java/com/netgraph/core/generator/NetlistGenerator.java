package com.netgraph.core.generator;

import com.netgraph.core.model.Module;

import java.util.List;

/**
 * Interface for generators that render a parsed module list into a text artifact.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI) and selected by
 * {@link #getId()} from configuration or the command line.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class VerilogGenerator implements NetlistGenerator {
 *     @Override
 *     public String getId() {
 *         return "verilog";
 *     }
 *
 *     @Override
 *     public String getDisplayName() {
 *         return "Structural Verilog Generator";
 *     }
 *
 *     @Override
 *     public String getFileExtension() {
 *         return "v";
 *     }
 *
 *     @Override
 *     public GeneratedArtifact generate(List<Module> modules, GeneratorConfig config) {
 *         String content = modules.stream().map(this::renderModule).collect(Collectors.joining());
 *         return new GeneratedArtifact(config.baseName("netlist"), content, getFileExtension());
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.netgraph.core.generator.NetlistGenerator}
 *
 * @see GeneratorConfig
 * @see GeneratedArtifact
 */
public interface NetlistGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used for referencing the generator in configuration. Lowercase
     * (e.g., "verilog", "graph", "summary").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name, used in CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension of the generated artifact, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Renders the module list.
     *
     * <p>An empty module list produces a valid, empty artifact.
     *
     * @param modules modules to render, in order
     * @param config generation settings
     * @return generated artifact
     */
    GeneratedArtifact generate(List<Module> modules, GeneratorConfig config);
}
