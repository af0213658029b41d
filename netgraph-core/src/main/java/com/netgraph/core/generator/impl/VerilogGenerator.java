package com.netgraph.core.generator.impl;

import com.netgraph.core.generator.GeneratedArtifact;
import com.netgraph.core.generator.GeneratorConfig;
import com.netgraph.core.generator.NetlistGenerator;
import com.netgraph.core.model.Direction;
import com.netgraph.core.model.Instance;
import com.netgraph.core.model.Module;
import com.netgraph.core.model.Net;
import com.netgraph.core.model.NetType;
import com.netgraph.core.model.Pin;
import com.netgraph.core.model.Port;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Regenerates structural source text from parsed modules.
 *
 * <p>Per module the output is:
 * <pre>
 * module top (
 *     input [3:0] a,
 *     output y
 * );
 *
 *     wire [3:0] n1;
 *
 *     AND2 u1 (.A(a[0]), .B(n1[1]), .Y(y));
 * endmodule
 * </pre>
 *
 * <p>Only nets declared with {@code wire} are re-declared. Unresolved pins are written
 * as empty connections {@code .p()}. Formatting and comments of the source are not
 * reproduced, but the output re-parses to the same ports, wires and pin topology.
 */
public class VerilogGenerator implements NetlistGenerator {

    private static final Logger log = LoggerFactory.getLogger(VerilogGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "verilog";
    private static final String GENERATOR_DISPLAY_NAME = "Structural Verilog Generator";
    private static final String FILE_EXTENSION = "v";
    private static final String DEFAULT_BASE_NAME = "output_netlist_file";

    // Source formatting
    private static final String INDENT = "    ";
    private static final String NEWLINE = "\n";
    private static final String PORT_SEPARATOR = ",\n";
    private static final String HEADER_COMMENT = "// Generated by netgraph" + NEWLINE;

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

        StringBuilder sb = new StringBuilder();
        if (config.headerComment()) {
            sb.append(HEADER_COMMENT).append(NEWLINE);
        }
        for (Module module : modules) {
            sb.append(renderModule(module));
        }

        log.info("Generated source for {} modules", modules.size());
        return new GeneratedArtifact(config.baseName(DEFAULT_BASE_NAME), sb.toString(), FILE_EXTENSION);
    }

    /**
     * Renders one module.
     *
     * @param module module to render
     * @return module source text, terminated by a blank line
     */
    public String renderModule(Module module) {
        Objects.requireNonNull(module, "module must not be null");
        log.debug("Rendering module {}", module.name());

        StringBuilder sb = new StringBuilder();
        sb.append("module ").append(module.name()).append(" (").append(NEWLINE);

        StringBuilder ports = new StringBuilder();
        for (Direction direction : Direction.values()) {
            for (Port port : module.ports(direction)) {
                ports.append(INDENT).append(direction.keyword()).append(' ');
                if (port.width() != null) {
                    ports.append(port.width().toVerilog()).append(' ');
                }
                ports.append(port.name()).append(PORT_SEPARATOR);
            }
        }
        if (ports.length() > 0) {
            ports.setLength(ports.length() - PORT_SEPARATOR.length());
        }
        sb.append(ports).append(NEWLINE).append(");").append(NEWLINE).append(NEWLINE);

        List<Net> wires = module.netList().stream()
            .filter(net -> net.type() == NetType.WIRE)
            .toList();
        for (Net wire : wires) {
            sb.append(INDENT).append("wire ");
            if (wire.width() != null) {
                sb.append(wire.width().toVerilog()).append(' ');
            }
            sb.append(wire.name()).append(';').append(NEWLINE);
        }
        if (!wires.isEmpty()) {
            sb.append(NEWLINE);
        }

        for (Instance instance : module.instances()) {
            sb.append(INDENT).append(renderInstance(module, instance)).append(NEWLINE);
        }

        sb.append("endmodule").append(NEWLINE).append(NEWLINE);
        return sb.toString();
    }

    private String renderInstance(Module module, Instance instance) {
        String pins = instance.pins().stream()
            .map(pin -> renderPin(module, pin))
            .collect(Collectors.joining(", "));
        return instance.refName() + " " + instance.name() + " (" + pins + ");";
    }

    private String renderPin(Module module, Pin pin) {
        String netName = module.netOf(pin).map(Net::name).orElse("");
        return "." + pin.name() + "(" + netName + ")";
    }
}
