package com.netgraph.core.compare;

import com.netgraph.core.model.Direction;
import com.netgraph.core.model.Instance;
import com.netgraph.core.model.Module;
import com.netgraph.core.model.Net;
import com.netgraph.core.model.NetType;
import com.netgraph.core.model.Pin;
import com.netgraph.core.model.Port;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Compares two module lists structurally.
 *
 * <p>Compared per module (matched by name): ports (name, direction, width) in order,
 * {@code wire} nets (name, width) in order, instances (name, reference, cell type) in
 * order, and each pin by name and connected net name. Net provenance other than
 * {@code wire} and pin directions are not compared.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * StructuralDiff diff = new NetlistComparator().compare(original.modules(), reparsed.modules());
 * if (!diff.isEquivalent()) {
 *     diff.differences().forEach(System.out::println);
 * }
 * }</pre>
 */
public class NetlistComparator {

    private static final Logger log = LoggerFactory.getLogger(NetlistComparator.class);

    private static final String NO_NET = "<unconnected>";

    /**
     * Compares two module lists.
     *
     * @param left reference modules
     * @param right modules to check
     * @return all differences found
     */
    public StructuralDiff compare(List<Module> left, List<Module> right) {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");

        List<String> differences = new ArrayList<>();
        for (Module module : left) {
            Optional<Module> other = right.stream().filter(m -> m.name().equals(module.name())).findFirst();
            if (other.isEmpty()) {
                differences.add("Module " + module.name() + " missing on right");
            } else {
                compareModule(module, other.get(), differences);
            }
        }
        for (Module module : right) {
            if (left.stream().noneMatch(m -> m.name().equals(module.name()))) {
                differences.add("Module " + module.name() + " missing on left");
            }
        }

        log.debug("Compared {} and {} modules: {} differences", left.size(), right.size(), differences.size());
        return new StructuralDiff(differences);
    }

    private void compareModule(Module left, Module right, List<String> differences) {
        String prefix = left.name() + ": ";

        for (Direction direction : Direction.values()) {
            List<String> leftPorts = left.ports(direction).stream().map(NetlistComparator::describe).toList();
            List<String> rightPorts = right.ports(direction).stream().map(NetlistComparator::describe).toList();
            if (!leftPorts.equals(rightPorts)) {
                differences.add(prefix + direction.keyword() + " ports differ: " + leftPorts + " vs " + rightPorts);
            }
        }

        List<String> leftWires = wires(left);
        List<String> rightWires = wires(right);
        if (!leftWires.equals(rightWires)) {
            differences.add(prefix + "wires differ: " + leftWires + " vs " + rightWires);
        }

        if (left.instances().size() != right.instances().size()) {
            differences.add(prefix + "instance count " + left.instances().size() + " vs " + right.instances().size());
        }
        int shared = Math.min(left.instances().size(), right.instances().size());
        for (int i = 0; i < shared; i++) {
            compareInstance(prefix, left, left.instances().get(i), right, right.instances().get(i), differences);
        }
    }

    private void compareInstance(String prefix, Module leftModule, Instance left,
                                 Module rightModule, Instance right, List<String> differences) {
        if (!left.name().equals(right.name())
            || !left.refName().equals(right.refName())
            || left.cellType() != right.cellType()) {
            differences.add(prefix + "instance " + left.refName() + " " + left.name() + " (" + left.cellType().tag()
                + ") vs " + right.refName() + " " + right.name() + " (" + right.cellType().tag() + ")");
            return;
        }
        List<String> leftPins = left.pins().stream().map(pin -> describe(leftModule, pin)).toList();
        List<String> rightPins = right.pins().stream().map(pin -> describe(rightModule, pin)).toList();
        if (!leftPins.equals(rightPins)) {
            differences.add(prefix + "pins of " + left.name() + " differ: " + leftPins + " vs " + rightPins);
        }
    }

    private static List<String> wires(Module module) {
        return module.netList().stream()
            .filter(net -> net.type() == NetType.WIRE)
            .map(net -> net.name() + (net.width() == null ? "" : net.width().toVerilog()))
            .toList();
    }

    private static String describe(Port port) {
        return port.name() + (port.width() == null ? "" : port.width().toVerilog());
    }

    private static String describe(Module module, Pin pin) {
        return pin.name() + "=" + module.netOf(pin).map(Net::name).orElse(NO_NET);
    }
}
