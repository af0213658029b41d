package com.netgraph.core.generator.impl;

import com.netgraph.core.generator.GeneratedArtifact;
import com.netgraph.core.generator.GeneratorConfig;
import com.netgraph.core.generator.NetlistGenerator;
import com.netgraph.core.model.BitRange;
import com.netgraph.core.model.Instance;
import com.netgraph.core.model.Module;
import com.netgraph.core.model.Net;
import com.netgraph.core.model.Pin;
import com.netgraph.core.model.Port;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Generates a Markdown report of parsed modules.
 *
 * <p>One section per module with tables for ports (width, derived nets), nets
 * (provenance, width) and instances (reference, cell type, pin connections).
 */
public class SummaryGenerator implements NetlistGenerator {

    private static final Logger log = LoggerFactory.getLogger(SummaryGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "summary";
    private static final String GENERATOR_DISPLAY_NAME = "Module Summary Generator";
    private static final String FILE_EXTENSION = "md";
    private static final String DEFAULT_BASE_NAME = "netlist_summary";

    // Markdown formatting constants
    private static final String H1 = "# ";
    private static final String H2 = "## ";
    private static final String H3 = "### ";
    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final String NONE = "-";
    private static final String UNCONNECTED = "_unconnected_";

    private static final String PORT_TABLE_HEADER =
        "| Name | Direction | Width | Derived Nets |\n|------|-----------|-------|--------------|\n";
    private static final String NET_TABLE_HEADER =
        "| Name | Type | Width |\n|------|------|-------|\n";
    private static final String INSTANCE_TABLE_HEADER =
        "| Instance | Reference | Cell Type | Connections |\n|----------|-----------|-----------|-------------|\n";

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
        sb.append(H1).append("Netlist Summary").append(DOUBLE_NEWLINE);
        sb.append("**Modules:** ").append(modules.size()).append(NEWLINE);
        sb.append("**Instances:** ").append(modules.stream().mapToInt(m -> m.instances().size()).sum())
            .append(DOUBLE_NEWLINE);

        for (Module module : modules) {
            appendModule(sb, module);
        }

        log.info("Generated summary for {} modules", modules.size());
        return new GeneratedArtifact(config.baseName(DEFAULT_BASE_NAME), sb.toString(), FILE_EXTENSION);
    }

    private void appendModule(StringBuilder sb, Module module) {
        sb.append(H2).append(module.name()).append(DOUBLE_NEWLINE);

        sb.append(H3).append("Ports").append(DOUBLE_NEWLINE);
        if (module.allPorts().isEmpty()) {
            sb.append("No ports.").append(DOUBLE_NEWLINE);
        } else {
            sb.append(PORT_TABLE_HEADER);
            for (Port port : module.allPorts()) {
                String derived = module.derivedNets(port).stream().map(Net::name).collect(Collectors.joining(", "));
                row(sb, port.name(), port.direction().keyword(), width(port.width()),
                    derived.isEmpty() ? NONE : derived);
            }
            sb.append(NEWLINE);
        }

        sb.append(H3).append("Nets").append(DOUBLE_NEWLINE);
        if (module.nets().isEmpty()) {
            sb.append("No nets.").append(DOUBLE_NEWLINE);
        } else {
            sb.append(NET_TABLE_HEADER);
            for (Net net : module.netList()) {
                row(sb, net.name(), net.type().tag(), width(net.width()));
            }
            sb.append(NEWLINE);
        }

        sb.append(H3).append("Instances").append(DOUBLE_NEWLINE);
        if (module.instances().isEmpty()) {
            sb.append("No instances.").append(DOUBLE_NEWLINE);
        } else {
            sb.append(INSTANCE_TABLE_HEADER);
            for (Instance instance : module.instances()) {
                row(sb, instance.name(), instance.refName(), instance.cellType().tag(), connections(module, instance));
            }
            sb.append(NEWLINE);
        }
    }

    private String connections(Module module, Instance instance) {
        if (instance.pins().isEmpty()) {
            return NONE;
        }
        return instance.pins().stream()
            .map(pin -> pin.name() + " → " + netName(module, pin))
            .collect(Collectors.joining(", "));
    }

    private String netName(Module module, Pin pin) {
        return module.netOf(pin).map(Net::name).orElse(UNCONNECTED);
    }

    private static String width(BitRange width) {
        return width == null ? NONE : width.toVerilog();
    }

    private static void row(StringBuilder sb, String... cells) {
        sb.append('|');
        for (String cell : cells) {
            sb.append(' ').append(escape(cell)).append(" |");
        }
        sb.append(NEWLINE);
    }

    private static String escape(String text) {
        return text.replace("|", "\\|");
    }
}
