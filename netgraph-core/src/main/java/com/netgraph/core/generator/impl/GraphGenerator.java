package com.netgraph.core.generator.impl;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.netgraph.core.generator.GeneratedArtifact;
import com.netgraph.core.generator.GeneratorConfig;
import com.netgraph.core.generator.NetlistGenerator;
import com.netgraph.core.model.Instance;
import com.netgraph.core.model.Module;
import com.netgraph.core.model.Net;
import com.netgraph.core.model.Pin;
import com.netgraph.core.model.Port;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Exports the connectivity of parsed modules as a JSON node/edge graph.
 *
 * <h2>Node identifiers</h2>
 * <ul>
 *   <li>{@code module.port} (type {@code port}, with direction)</li>
 *   <li>{@code module.instance} (type {@code instance})</li>
 *   <li>{@code module.instance.pin} (type {@code pin})</li>
 *   <li>{@code module.net} (type {@code net}, one node per distinct name)</li>
 * </ul>
 *
 * <p>Every pin has an edge from its instance; every connected pin has an edge to its net.
 * Nets no pin connects to do not appear.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * GeneratedArtifact graph = new GraphGenerator().generate(result.modules(), GeneratorConfig.defaults());
 * }</pre>
 */
public class GraphGenerator implements NetlistGenerator {

    private static final Logger log = LoggerFactory.getLogger(GraphGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "graph";
    private static final String GENERATOR_DISPLAY_NAME = "Connectivity Graph Generator";
    private static final String FILE_EXTENSION = "json";
    private static final String DEFAULT_BASE_NAME = "netlist_graph";

    // Node types
    private static final String NODE_PORT = "port";
    private static final String NODE_INSTANCE = "instance";
    private static final String NODE_PIN = "pin";
    private static final String NODE_NET = "net";

    private static final String SEPARATOR = ".";

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public GeneratedArtifact generate(List<Module> modules, GeneratorConfig config) {
        Objects.requireNonNull(modules, "modules must not be null");
        Objects.requireNonNull(config, "config must not be null");

        Graph graph = buildGraph(modules);
        log.info("Generated graph with {} nodes and {} edges", graph.nodes().size(), graph.edges().size());

        try {
            String content = JSON_MAPPER.writeValueAsString(graph);
            return new GeneratedArtifact(config.baseName(DEFAULT_BASE_NAME), content, FILE_EXTENSION);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize netlist graph", e);
        }
    }

    /**
     * Builds the node/edge graph of the given modules.
     *
     * @param modules parsed modules
     * @return graph with de-duplicated net nodes
     */
    public Graph buildGraph(List<Module> modules) {
        List<Node> nodes = new ArrayList<>();
        List<Edge> edges = new ArrayList<>();

        for (Module module : modules) {
            String prefix = module.name() + SEPARATOR;
            for (Port port : module.allPorts()) {
                nodes.add(new Node(prefix + port.name(), NODE_PORT, port.name(), port.direction().keyword()));
            }

            Set<String> netIds = new LinkedHashSet<>();
            for (Instance instance : module.instances()) {
                String instanceId = prefix + instance.name();
                nodes.add(new Node(instanceId, NODE_INSTANCE, instance.refName(), null));

                for (Pin pin : instance.pins()) {
                    String pinId = instanceId + SEPARATOR + pin.name();
                    String direction = pin.knownDirection().map(d -> d.keyword()).orElse(null);
                    nodes.add(new Node(pinId, NODE_PIN, pin.name(), direction));
                    edges.add(new Edge(instanceId, pinId));

                    Optional<Net> net = module.netOf(pin);
                    if (net.isPresent()) {
                        String netId = prefix + net.get().name();
                        if (netIds.add(netId)) {
                            nodes.add(new Node(netId, NODE_NET, net.get().name(), null));
                        }
                        edges.add(new Edge(pinId, netId));
                    }
                }
            }
        }
        return new Graph(nodes, edges);
    }

    /**
     * Graph document.
     *
     * @param nodes all nodes
     * @param edges directed edges
     */
    public record Graph(List<Node> nodes, List<Edge> edges) {
    }

    /**
     * Graph node.
     *
     * @param id hierarchical identifier
     * @param type node type
     * @param label display label
     * @param direction port or pin direction, omitted when unknown
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Node(String id, String type, String label, String direction) {
    }

    /**
     * Directed graph edge.
     *
     * @param source source node id
     * @param target target node id
     */
    public record Edge(String source, String target) {
    }
}
