package com.netgraph.core.codec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * One module record of the JSON exchange document.
 *
 * <p>Example:
 * <pre>{@code
 * {
 *   "module_name": "top",
 *   "ports": {
 *     "input": [ { "name": "a", "direction": "input", "width": [3, 0] } ],
 *     "output": [ { "name": "y", "direction": "output", "width": null } ]
 *   },
 *   "instances": [ {
 *     "instance": "u1", "cell_type": "leaf-level", "ref_name": "AND2",
 *     "pins": [ { "name": "A", "direction": null, "instance": "u1", "net": "a[0]" } ]
 *   } ],
 *   "nets": [ { "name": "n1", "net_type": "wire", "width": null } ]
 * }
 * }</pre>
 *
 * @param moduleName module name
 * @param ports ports keyed by direction
 * @param instances instances in declaration order
 * @param nets the module's net collection
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"module_name", "ports", "instances", "nets"})
public record ModuleDocument(
    @JsonProperty("module_name") String moduleName,
    @JsonProperty("ports") PortsDocument ports,
    @JsonProperty("instances") List<InstanceDocument> instances,
    @JsonProperty("nets") List<NetDocument> nets
) {
    public ModuleDocument {
        ports = ports != null ? ports : new PortsDocument(List.of(), List.of());
        instances = instances != null ? instances : List.of();
        nets = nets != null ? nets : List.of();
    }

    /**
     * Ports grouped by direction.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"input", "output"})
    public record PortsDocument(
        @JsonProperty("input") List<PortDocument> input,
        @JsonProperty("output") List<PortDocument> output
    ) {
        public PortsDocument {
            input = input != null ? input : List.of();
            output = output != null ? output : List.of();
        }
    }

    /**
     * A port; width is {@code [msb, lsb]} or null.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"name", "direction", "width"})
    public record PortDocument(
        @JsonProperty("name") String name,
        @JsonProperty("direction") String direction,
        @JsonProperty("width") List<Integer> width
    ) {
    }

    /**
     * An instance with its pins.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"instance", "cell_type", "ref_name", "pins"})
    public record InstanceDocument(
        @JsonProperty("instance") String instance,
        @JsonProperty("cell_type") String cellType,
        @JsonProperty("ref_name") String refName,
        @JsonProperty("pins") List<PinDocument> pins
    ) {
        public InstanceDocument {
            pins = pins != null ? pins : List.of();
        }
    }

    /**
     * A pin; {@code net} is the connected net's name, null when unresolved.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"name", "direction", "instance", "net"})
    public record PinDocument(
        @JsonProperty("name") String name,
        @JsonProperty("direction") String direction,
        @JsonProperty("instance") String instance,
        @JsonProperty("net") String net
    ) {
    }

    /**
     * A net of the module's collection.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"name", "net_type", "width"})
    public record NetDocument(
        @JsonProperty("name") String name,
        @JsonProperty("net_type") String netType,
        @JsonProperty("width") List<Integer> width
    ) {
    }
}
