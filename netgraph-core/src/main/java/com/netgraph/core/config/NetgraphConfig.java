package com.netgraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.List;

/**
 * Root configuration, loaded from {@code netgraph.yaml}.
 *
 * <p>Every section and key is optional; absent values take their defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * input:
 *   netlist: "design/top.v"
 *
 * output:
 *   directory: "./build/netlist"
 *   verilogFile: "output_netlist_file.v"
 *   jsonFile: "parsed_objects.json"
 *
 * parser:
 *   validateInstances: true
 *   reuseJson: false
 *
 * generators:
 *   enabled:
 *     - verilog
 *     - summary
 *   headerComment: true
 * }</pre>
 *
 * @param input input configuration
 * @param output output configuration
 * @param parser parser configuration
 * @param generators generator configuration
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NetgraphConfig(
    @JsonProperty("input") InputConfig input,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("parser") ParserConfig parser,
    @JsonProperty("generators") GeneratorSettings generators
) {
    public static final String DEFAULT_NETLIST = "netlist.v";
    public static final String DEFAULT_VERILOG_FILE = "output_netlist_file.v";
    public static final String DEFAULT_JSON_FILE = "parsed_objects.json";

    public NetgraphConfig {
        input = input != null ? input : new InputConfig(null);
        output = output != null ? output : new OutputConfig(null, null, null);
        parser = parser != null ? parser : new ParserConfig(null, null);
        generators = generators != null ? generators : new GeneratorSettings(null, null);
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static NetgraphConfig defaults() {
        return new NetgraphConfig(null, null, null, null);
    }

    /**
     * Returns a copy writing all outputs to another directory.
     *
     * @param directory output directory
     * @return updated configuration
     */
    public NetgraphConfig withOutputDirectory(String directory) {
        return new NetgraphConfig(input,
            new OutputConfig(directory, output.verilogFile(), output.jsonFile()), parser, generators);
    }

    /**
     * Returns a copy with different parser switches.
     *
     * @param validateInstances whether instances are validated
     * @param reuseJson whether an existing JSON exchange file is reused
     * @return updated configuration
     */
    public NetgraphConfig withParser(boolean validateInstances, boolean reuseJson) {
        return new NetgraphConfig(input, output, new ParserConfig(validateInstances, reuseJson), generators);
    }

    /**
     * Input settings.
     *
     * @param netlist netlist source file
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InputConfig(
        @JsonProperty("netlist") String netlist
    ) {
        public InputConfig {
            netlist = netlist != null ? netlist : DEFAULT_NETLIST;
        }
    }

    /**
     * Output settings.
     *
     * @param directory directory all outputs are written to
     * @param verilogFile regenerated source file name
     * @param jsonFile JSON exchange file name
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("verilogFile") String verilogFile,
        @JsonProperty("jsonFile") String jsonFile
    ) {
        public OutputConfig {
            directory = directory != null ? directory : ".";
            verilogFile = verilogFile != null ? verilogFile : DEFAULT_VERILOG_FILE;
            jsonFile = jsonFile != null ? jsonFile : DEFAULT_JSON_FILE;
        }

        /**
         * Resolves the JSON exchange file against the output directory.
         *
         * @return JSON file path
         */
        public Path jsonPath() {
            return Path.of(directory).resolve(jsonFile);
        }

        /**
         * Resolves the regenerated source file against the output directory.
         *
         * @return source file path
         */
        public Path verilogPath() {
            return Path.of(directory).resolve(verilogFile);
        }
    }

    /**
     * Parser settings.
     *
     * @param validateInstances whether parsed instances are checked against templates
     * @param reuseJson whether an existing JSON exchange file is loaded instead of re-parsing
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParserConfig(
        @JsonProperty("validateInstances") Boolean validateInstances,
        @JsonProperty("reuseJson") Boolean reuseJson
    ) {
        public ParserConfig {
            validateInstances = validateInstances != null ? validateInstances : Boolean.TRUE;
            reuseJson = reuseJson != null ? reuseJson : Boolean.TRUE;
        }
    }

    /**
     * Generator settings.
     *
     * @param enabled generator ids run by {@code generate}
     * @param headerComment whether regenerated source starts with a comment header
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeneratorSettings(
        @JsonProperty("enabled") List<String> enabled,
        @JsonProperty("headerComment") Boolean headerComment
    ) {
        public GeneratorSettings {
            enabled = enabled != null && !enabled.isEmpty() ? List.copyOf(enabled) : List.of("verilog");
            headerComment = headerComment != null ? headerComment : Boolean.FALSE;
        }
    }
}
