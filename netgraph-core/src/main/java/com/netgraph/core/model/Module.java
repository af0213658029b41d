package com.netgraph.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed module: ports, nets and instances.
 *
 * <p>Every {@link Net} the module knows about lives in {@link #arena()}. Ports and pins
 * refer to nets through {@link NetRef} handles into that arena. {@link #nets()} lists
 * the handles that make up the module's own net collection: declared wires and
 * port-derived nets. Bit-select aliases and constants are reachable from pins only.
 *
 * @param name module name
 * @param inputs input ports in declaration order
 * @param outputs output ports in declaration order
 * @param arena every net referenced by this module
 * @param nets handles of the module's net collection, in creation order
 * @param instances instances in declaration order
 */
public record Module(
    String name,
    List<Port> inputs,
    List<Port> outputs,
    List<Net> arena,
    List<NetRef> nets,
    List<Instance> instances
) {
    /**
     * Compact constructor with validation.
     */
    public Module {
        Objects.requireNonNull(name, "name must not be null");
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        arena = arena == null ? List.of() : List.copyOf(arena);
        nets = nets == null ? List.of() : List.copyOf(nets);
        instances = instances == null ? List.of() : List.copyOf(instances);

        int size = arena.size();
        for (NetRef ref : nets) {
            checkRef(name, ref, size);
        }
        for (Port port : inputs) {
            port.derivedNets().forEach(ref -> checkRef(name, ref, size));
        }
        for (Port port : outputs) {
            port.derivedNets().forEach(ref -> checkRef(name, ref, size));
        }
        for (Instance instance : instances) {
            for (Pin pin : instance.pins()) {
                if (pin.net() != null) {
                    checkRef(name, pin.net(), size);
                }
            }
        }
    }

    private static void checkRef(String module, NetRef ref, int arenaSize) {
        if (ref.index() >= arenaSize) {
            throw new IllegalArgumentException(
                "Net handle " + ref.index() + " outside arena of module " + module + " (size " + arenaSize + ")");
        }
    }

    /**
     * Returns the ports of one direction.
     *
     * @param direction port direction
     * @return ports in declaration order
     */
    public List<Port> ports(Direction direction) {
        return direction == Direction.INPUT ? inputs : outputs;
    }

    /**
     * Returns all ports, inputs first.
     *
     * @return inputs followed by outputs
     */
    public List<Port> allPorts() {
        List<Port> all = new ArrayList<>(inputs.size() + outputs.size());
        all.addAll(inputs);
        all.addAll(outputs);
        return all;
    }

    /**
     * Finds a port by exact name.
     *
     * @param portName port name
     * @return the first matching port, inputs searched first
     */
    public Optional<Port> findPort(String portName) {
        return allPorts().stream()
            .filter(port -> port.name().equals(portName))
            .findFirst();
    }

    /**
     * Dereferences a net handle.
     *
     * @param ref net handle
     * @return the net
     */
    public Net net(NetRef ref) {
        return arena.get(ref.index());
    }

    /**
     * Returns the module's net collection as nets.
     *
     * @return declared and port-derived nets in creation order
     */
    public List<Net> netList() {
        return nets.stream().map(this::net).toList();
    }

    /**
     * Returns the nets linked to a port.
     *
     * @param port a port of this module
     * @return derived nets in link order
     */
    public List<Net> derivedNets(Port port) {
        return port.derivedNets().stream().map(this::net).toList();
    }

    /**
     * Returns the net a pin connects to.
     *
     * @param pin a pin of one of this module's instances
     * @return connected net, empty when unresolved
     */
    public Optional<Net> netOf(Pin pin) {
        return pin.connection().map(this::net);
    }

    /**
     * Finds an instance by name.
     *
     * @param instanceName instance name
     * @return matching instance
     */
    public Optional<Instance> findInstance(String instanceName) {
        return instances.stream()
            .filter(instance -> instance.name().equals(instanceName))
            .findFirst();
    }
}
