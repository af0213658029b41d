package com.netgraph.core.parser;

import com.netgraph.core.error.ErrorKind;
import com.netgraph.core.error.NetlistException;
import com.netgraph.core.model.BitRange;
import com.netgraph.core.model.CellType;
import com.netgraph.core.model.DiagnosticKind;
import com.netgraph.core.model.Direction;
import com.netgraph.core.model.ModuleTemplate;
import com.netgraph.core.model.NetRef;
import com.netgraph.core.model.NetlistResult;
import com.netgraph.core.model.TemplatePort;
import com.netgraph.core.parser.base.AbstractLineParser;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;

/**
 * Body pass: builds the full module graph in one forward scan.
 *
 * <p>Per non-blank, non-comment line:
 * <ol>
 *   <li>A module header opens a new module (ports on the header line are recorded).</li>
 *   <li>Inside a module, port and wire clauses are recorded.</li>
 *   <li>An {@code ref name (} line opens an instance, classified against the templates.</li>
 *   <li>While an instance is open, every {@code .pin(expr)} token is resolved through
 *       {@link NetResolver}; a line containing {@code );} closes the instance.</li>
 *   <li>{@code endmodule} closes the module.</li>
 * </ol>
 *
 * <p>Unbalanced module/endmodule counts and malformed pin tokens abort the whole parse.
 * Unresolved connections are collected as diagnostics and the parse continues.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<ModuleTemplate> templates = new TemplateExtractor().extract(file);
 * NetlistResult result = new NetlistParser().parse(file, templates);
 * }</pre>
 */
public class NetlistParser extends AbstractLineParser {

    private final NetResolver resolver;

    public NetlistParser() {
        this(new NetResolver());
    }

    public NetlistParser(NetResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /**
     * Parses a source file.
     *
     * @param file netlist source
     * @param templates templates from {@link TemplateExtractor}
     * @return modules and diagnostics
     * @throws NetlistException on IO failure, unbalanced counts or malformed instance lines
     */
    public NetlistResult parse(Path file, List<ModuleTemplate> templates) throws NetlistException {
        return parse(readLines(file), templates);
    }

    /**
     * Parses in-memory source text.
     *
     * @param source netlist text
     * @param templates templates from {@link TemplateExtractor}
     * @return modules and diagnostics
     * @throws NetlistException on unbalanced counts or malformed instance lines
     */
    public NetlistResult parseSource(String source, List<ModuleTemplate> templates) throws NetlistException {
        return parse(toLines(source), templates);
    }

    /**
     * Parses source lines.
     *
     * @param lines netlist lines
     * @param templates templates from {@link TemplateExtractor}
     * @return modules and diagnostics
     * @throws NetlistException on unbalanced counts or malformed instance lines
     */
    public NetlistResult parse(List<String> lines, List<ModuleTemplate> templates) throws NetlistException {
        Objects.requireNonNull(lines, "lines must not be null");
        Objects.requireNonNull(templates, "templates must not be null");

        ParserContext context = new ParserContext();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            context.advance(i + 1);
            if (isSkippable(line)) {
                continue;
            }
            processLine(context, line, templates);
        }

        if (context.moduleCount() != context.endModuleCount()) {
            log.error("Found {} module and {} endmodule declarations", context.moduleCount(),
                context.endModuleCount());
            throw NetlistException.structuralMismatch(context.moduleCount(), context.endModuleCount());
        }

        NetlistResult result = new NetlistResult(context.buildModules(), context.diagnostics());
        log.info("Parsed {} modules ({} diagnostics)", result.modules().size(), result.diagnostics().size());
        return result;
    }

    void processLine(ParserContext context, String line, List<ModuleTemplate> templates) throws NetlistException {
        Matcher open = findFirst(NetlistPatterns.MODULE_OPEN, line);
        if (open != null) {
            ModuleBuilder module = context.openModule(open.group(1));
            log.debug("Module found: {}", module.name());
            declarePorts(module, line.substring(open.end()), context.lineNumber());
        } else if (context.inModule()) {
            ModuleBuilder module = context.currentModule();
            declarePorts(module, line, context.lineNumber());
            declareNets(module, line, context.lineNumber());
            openInstance(context, line, templates);
            if (context.insideInstance()) {
                connectPins(context, line);
            }
        }

        if (matches(NetlistPatterns.END_MODULE, line)) {
            if (context.insideInstance()) {
                log.warn("Instance {} not closed before endmodule at line {}",
                    context.currentInstance().name(), context.lineNumber());
            }
            context.closeModule();
        }
    }

    private void declarePorts(ModuleBuilder module, String text, int lineNumber) throws NetlistException {
        for (MatchResult clause : findAll(NetlistPatterns.PORT_DECL, text)) {
            Direction direction = Direction.fromKeyword(clause.group(1));
            BitRange width = range(clause.group(2), clause.group(3), lineNumber);
            for (String portName : NetlistPatterns.splitNames(clause.group(4))) {
                module.addPort(portName, direction, width);
                log.debug("Port found: {} {} {}", direction.keyword(), portName, width);
            }
        }
    }

    private void declareNets(ModuleBuilder module, String line, int lineNumber) throws NetlistException {
        for (MatchResult clause : findAll(NetlistPatterns.NET_DECL, line)) {
            BitRange clauseWidth = range(clause.group(1), clause.group(2), lineNumber);
            for (String item : clause.group(3).split(",")) {
                Matcher declared = NetlistPatterns.NET_ITEM.matcher(item.trim());
                if (!declared.matches()) {
                    continue;
                }
                BitRange inline = range(declared.group(1), declared.group(2), lineNumber);
                BitRange width = inline != null ? inline : clauseWidth;
                module.declareWire(declared.group(3), width);
                log.debug("Net declared: {} {}", declared.group(3), width);
            }
        }
    }

    private void openInstance(ParserContext context, String line, List<ModuleTemplate> templates) {
        Matcher header = findFirst(NetlistPatterns.INSTANCE_OPEN, line);
        if (header == null || NetlistPatterns.NON_INSTANCE_KEYWORDS.contains(header.group(1))) {
            return;
        }
        String refName = header.group(1);
        String instanceName = header.group(2);
        Optional<ModuleTemplate> template = templates.stream().filter(t -> t.matches(refName)).findFirst();
        CellType cellType = template.isPresent() ? CellType.HIERARCHICAL : CellType.LEAF_LEVEL;

        InstanceBuilder instance = context.currentModule().openInstance(instanceName, refName, cellType);
        context.openInstance(instance, template.orElse(null));
        log.debug("Instance found: {} {} ({})", refName, instanceName, cellType.tag());
    }

    private void connectPins(ParserContext context, String line) throws NetlistException {
        List<MatchResult> tokens = findAll(NetlistPatterns.PIN, line);
        if (count(NetlistPatterns.PIN_START, line) != tokens.size()) {
            log.error("Unterminated pin connection at line {}: {}", context.lineNumber(), line.trim());
            throw NetlistException.malformedInstanceLine(context.lineNumber(), line, "Unterminated pin connection");
        }

        InstanceBuilder instance = context.currentInstance();
        for (MatchResult token : tokens) {
            String pinName = token.group(1);
            String expression = token.group(2).trim();
            Direction direction = pinDirection(context.currentTemplate(), pinName);

            if (expression.isEmpty()) {
                instance.addPin(pinName, direction, null);
                log.debug("Pin {}.{} left unconnected", instance.name(), pinName);
                continue;
            }

            Optional<NetRef> net = resolver.resolve(expression, context.currentModule(), context.lineNumber());
            if (net.isEmpty()) {
                String message = "No net found for pin " + pinName + " of instance " + instance.name()
                    + " connected to '" + expression + "'";
                context.report(DiagnosticKind.UNRESOLVED_REFERENCE, message);
                log.warn("{} (line {})", message, context.lineNumber());
            }
            instance.addPin(pinName, direction, net.orElse(null));
        }

        if (matches(NetlistPatterns.INSTANCE_CLOSE, line)) {
            context.closeInstance();
        }
    }

    private static Direction pinDirection(ModuleTemplate template, String pinName) {
        if (template == null) {
            return null;
        }
        for (Direction direction : Direction.values()) {
            for (TemplatePort port : template.ports(direction)) {
                if (port.name().equals(pinName)) {
                    return direction;
                }
            }
        }
        return null;
    }

    private BitRange range(String msb, String lsb, int lineNumber) throws NetlistException {
        if (msb == null || lsb == null) {
            return null;
        }
        try {
            return new BitRange(Integer.parseInt(msb), Integer.parseInt(lsb));
        } catch (NumberFormatException e) {
            log.error("Bit range [{}:{}] out of bounds at line {}", msb, lsb, lineNumber);
            throw new NetlistException(ErrorKind.MALFORMED_DECLARATION,
                "Bit range [" + msb + ":" + lsb + "] is out of bounds", lineNumber, e);
        }
    }
}
