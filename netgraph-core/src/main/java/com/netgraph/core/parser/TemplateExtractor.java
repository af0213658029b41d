package com.netgraph.core.parser;

import com.netgraph.core.error.NetlistException;
import com.netgraph.core.model.Direction;
import com.netgraph.core.model.ModuleTemplate;
import com.netgraph.core.model.TemplatePort;
import com.netgraph.core.parser.base.AbstractLineParser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;

/**
 * First pass: collects the name and port signature of every module.
 *
 * <p>Templates classify instances as hierarchical or leaf-level during the body pass
 * and drive pin-name validation. The pass fails before returning anything when the
 * number of {@code module} openings differs from the number of {@code endmodule}
 * closings.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<ModuleTemplate> templates = new TemplateExtractor().extract(Path.of("design.v"));
 * }</pre>
 */
public class TemplateExtractor extends AbstractLineParser {

    /**
     * Extracts templates from a source file.
     *
     * @param file netlist source
     * @return templates in source order
     * @throws NetlistException on IO failure or unbalanced module/endmodule counts
     */
    public List<ModuleTemplate> extract(Path file) throws NetlistException {
        return extract(readLines(file));
    }

    /**
     * Extracts templates from in-memory source text.
     *
     * @param source netlist text
     * @return templates in source order
     * @throws NetlistException on unbalanced module/endmodule counts
     */
    public List<ModuleTemplate> extractSource(String source) throws NetlistException {
        return extract(toLines(source));
    }

    /**
     * Extracts templates from source lines.
     *
     * @param lines netlist lines
     * @return templates in source order
     * @throws NetlistException on unbalanced module/endmodule counts
     */
    public List<ModuleTemplate> extract(List<String> lines) throws NetlistException {
        Objects.requireNonNull(lines, "lines must not be null");

        List<ModuleTemplate> templates = new ArrayList<>();
        int moduleCount = 0;
        int endModuleCount = 0;
        String name = null;
        List<TemplatePort> inputs = new ArrayList<>();
        List<TemplatePort> outputs = new ArrayList<>();

        for (String line : lines) {
            if (isSkippable(line)) {
                continue;
            }

            Matcher open = findFirst(NetlistPatterns.MODULE_OPEN, line);
            if (open != null) {
                moduleCount++;
                name = open.group(1);
                inputs = new ArrayList<>();
                outputs = new ArrayList<>();
                log.debug("Template module found: {}", name);
                collectPorts(line.substring(open.end()), inputs, outputs);
            } else if (name != null) {
                collectPorts(line, inputs, outputs);
            }

            if (matches(NetlistPatterns.END_MODULE, line)) {
                endModuleCount++;
                if (name != null) {
                    templates.add(new ModuleTemplate(name, inputs, outputs));
                    name = null;
                }
            }
        }

        if (moduleCount != endModuleCount) {
            log.error("Template pass found {} module and {} endmodule declarations", moduleCount, endModuleCount);
            throw NetlistException.structuralMismatch(moduleCount, endModuleCount);
        }

        log.info("Extracted {} module templates", templates.size());
        return templates;
    }

    private void collectPorts(String text, List<TemplatePort> inputs, List<TemplatePort> outputs) {
        for (MatchResult clause : findAll(NetlistPatterns.PORT_DECL, text)) {
            Direction direction = Direction.fromKeyword(clause.group(1));
            String width = clause.group(2) != null ? clause.group(2) + ":" + clause.group(3) : null;
            for (String portName : NetlistPatterns.splitNames(clause.group(4))) {
                (direction == Direction.INPUT ? inputs : outputs).add(new TemplatePort(portName, width));
            }
        }
    }
}
