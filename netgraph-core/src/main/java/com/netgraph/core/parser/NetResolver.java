package com.netgraph.core.parser;

import com.netgraph.core.error.ErrorKind;
import com.netgraph.core.error.NetlistException;
import com.netgraph.core.model.BitRange;
import com.netgraph.core.model.Net;
import com.netgraph.core.model.NetRef;
import com.netgraph.core.model.NetType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Maps a pin connection expression to a net of the enclosing module.
 *
 * <p>Decision order:
 * <ol>
 *   <li><b>Bit select</b> {@code base[n]} of a declared wire: a fresh {@code wire-single}
 *       net named by the full text, width {@code [1:0]}, linked to a port named
 *       {@code base} (case-insensitive) when one exists. Without a wire named
 *       {@code base} resolution falls through to the fallback.</li>
 *   <li><b>Constant</b> (text contains {@code '}): a fresh {@code constant} net.</li>
 *   <li><b>Identifier</b>: a port of that exact name gets a fresh {@code port-derived}
 *       net; otherwise the declared wire of that name is shared.</li>
 *   <li><b>Fallback</b>: the base identifier (index stripped) is matched against port
 *       names; a match gets a fresh {@code port-derived} net, otherwise the expression
 *       is unresolved.</li>
 * </ol>
 *
 * <p>Only declared wires are ever shared. Every synthesized net is allocated per
 * occurrence, even for identical text.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Optional<NetRef> ref = resolver.resolve("a[2]", moduleBuilder, lineNumber);
 * }</pre>
 */
public class NetResolver {

    private static final Logger log = LoggerFactory.getLogger(NetResolver.class);

    /**
     * Resolves one connection expression.
     *
     * @param expression trimmed, non-empty connection text
     * @param module module under construction
     * @param line 1-based source line, for error reporting
     * @return handle of the connected net, empty when unresolved
     * @throws NetlistException with {@code MALFORMED_INSTANCE_LINE} for an indexed
     *                          expression that is not {@code ident[n]}
     */
    public Optional<NetRef> resolve(String expression, ModuleBuilder module, int line) throws NetlistException {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(module, "module must not be null");

        if (expression.endsWith("]")) {
            Optional<NetRef> selected = resolveBitSelect(expression, module, line);
            if (selected.isPresent()) {
                return selected;
            }
        } else if (NetlistPatterns.isConstant(expression)) {
            NetRef ref = module.allocate(new Net(expression, NetType.CONSTANT, null));
            log.debug("Constant net created: {}", expression);
            return Optional.of(ref);
        } else {
            Optional<NetRef> named = resolveIdentifier(expression, module);
            if (named.isPresent()) {
                return named;
            }
        }
        return resolveFallback(expression, module);
    }

    private Optional<NetRef> resolveBitSelect(String expression, ModuleBuilder module, int line)
            throws NetlistException {
        Matcher matcher = NetlistPatterns.BIT_SELECT.matcher(expression);
        if (!matcher.matches()) {
            throw new NetlistException(ErrorKind.MALFORMED_INSTANCE_LINE,
                "Unsupported indexed expression '" + expression + "'", line);
        }
        String base = matcher.group(1);
        if (module.findWire(base).isEmpty()) {
            return Optional.empty();
        }

        NetRef ref = module.allocate(new Net(expression, NetType.WIRE_SINGLE, BitRange.SINGLE));
        module.findPortIgnoreCase(base).ifPresent(port -> {
            module.linkToPort(port, ref);
            log.debug("Net {} linked to port {}", expression, port.name());
        });
        log.debug("Single-bit net created: {}", expression);
        return Optional.of(ref);
    }

    private Optional<NetRef> resolveIdentifier(String expression, ModuleBuilder module) {
        Optional<ModuleBuilder.PortEntry> port = module.findPort(expression);
        if (port.isPresent()) {
            return Optional.of(derive(expression, port.get(), module));
        }
        Optional<NetRef> wire = module.findWire(expression);
        wire.ifPresent(ref -> log.debug("Net reused: {}", expression));
        return wire;
    }

    private Optional<NetRef> resolveFallback(String expression, ModuleBuilder module) {
        Matcher prefix = NetlistPatterns.BIT_SELECT_PREFIX.matcher(expression);
        String base = prefix.find() ? prefix.group(1) : expression;
        return module.findPort(base).map(port -> derive(expression, port, module));
    }

    private NetRef derive(String netName, ModuleBuilder.PortEntry port, ModuleBuilder module) {
        NetRef ref = module.addNet(new Net(netName, NetType.PORT_DERIVED, BitRange.SINGLE));
        module.linkToPort(port, ref);
        log.debug("Port-derived net {} created for port {}", netName, port.name());
        return ref;
    }
}
