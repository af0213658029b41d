package com.netgraph.core.parser;

import com.netgraph.core.model.BitRange;
import com.netgraph.core.model.CellType;
import com.netgraph.core.model.Direction;
import com.netgraph.core.model.Instance;
import com.netgraph.core.model.Module;
import com.netgraph.core.model.Net;
import com.netgraph.core.model.NetRef;
import com.netgraph.core.model.NetType;
import com.netgraph.core.model.Port;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable accumulator for one {@link Module}.
 *
 * <p>Owns the module's net arena. Nets are allocated once and referred to by
 * {@link NetRef} everywhere else, so two pins share a net exactly when they hold
 * the same handle.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ModuleBuilder builder = new ModuleBuilder("top");
 * builder.addPort("a", Direction.INPUT, null);
 * NetRef n1 = builder.declareWire("n1", null);
 * InstanceBuilder u1 = builder.openInstance("u1", "AND2", CellType.LEAF_LEVEL);
 * u1.addPin("A", n1);
 * Module module = builder.build();
 * }</pre>
 */
public final class ModuleBuilder {

    private final String name;
    private final List<PortEntry> inputs = new ArrayList<>();
    private final List<PortEntry> outputs = new ArrayList<>();
    private final List<Net> arena = new ArrayList<>();
    private final List<NetRef> members = new ArrayList<>();
    private final Map<String, NetRef> wiresByName = new HashMap<>();
    private final List<InstanceBuilder> instances = new ArrayList<>();

    public ModuleBuilder(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String name() {
        return name;
    }

    // ==================== Ports ====================

    /**
     * Appends a port.
     *
     * @param portName port name
     * @param direction port direction
     * @param width optional range
     * @return the new port entry
     */
    public PortEntry addPort(String portName, Direction direction, BitRange width) {
        PortEntry entry = new PortEntry(portName, direction, width);
        (direction == Direction.INPUT ? inputs : outputs).add(entry);
        return entry;
    }

    /**
     * Finds a port by exact name, inputs first.
     *
     * @param portName port name
     * @return first matching port
     */
    public Optional<PortEntry> findPort(String portName) {
        return allPorts().stream().filter(port -> port.name.equals(portName)).findFirst();
    }

    /**
     * Finds a port by name ignoring case, inputs first.
     *
     * @param portName port name
     * @return first matching port
     */
    public Optional<PortEntry> findPortIgnoreCase(String portName) {
        return allPorts().stream().filter(port -> port.name.equalsIgnoreCase(portName)).findFirst();
    }

    /**
     * Links a net to a port's derived-net list.
     *
     * @param port port entry of this module
     * @param ref net handle
     */
    public void linkToPort(PortEntry port, NetRef ref) {
        port.derived.add(ref);
    }

    private List<PortEntry> allPorts() {
        List<PortEntry> all = new ArrayList<>(inputs);
        all.addAll(outputs);
        return all;
    }

    // ==================== Nets ====================

    /**
     * Declares a wire: allocates it, adds it to the module's net collection and
     * indexes it by name. The first declaration of a name wins lookups.
     *
     * @param netName wire name
     * @param width optional range
     * @return handle of the new net
     */
    public NetRef declareWire(String netName, BitRange width) {
        NetRef ref = allocate(new Net(netName, NetType.WIRE, width));
        members.add(ref);
        wiresByName.putIfAbsent(netName, ref);
        return ref;
    }

    /**
     * Allocates a net in the arena without adding it to the net collection.
     *
     * @param net net to store
     * @return its handle
     */
    public NetRef allocate(Net net) {
        arena.add(Objects.requireNonNull(net, "net must not be null"));
        return new NetRef(arena.size() - 1);
    }

    /**
     * Allocates a net and adds it to the net collection.
     *
     * @param net net to store
     * @return its handle
     */
    public NetRef addNet(Net net) {
        NetRef ref = allocate(net);
        members.add(ref);
        return ref;
    }

    /**
     * Finds a declared wire by exact name.
     *
     * @param netName wire name
     * @return handle of the first declaration
     */
    public Optional<NetRef> findWire(String netName) {
        return Optional.ofNullable(wiresByName.get(netName));
    }

    public Net net(NetRef ref) {
        return arena.get(ref.index());
    }

    // ==================== Instances ====================

    /**
     * Starts a new instance, appended in declaration order.
     *
     * @param instanceName instance name
     * @param refName referenced module or cell
     * @param cellType classification
     * @return builder for the instance's pins
     */
    public InstanceBuilder openInstance(String instanceName, String refName, CellType cellType) {
        InstanceBuilder instance = new InstanceBuilder(instanceName, refName, cellType);
        instances.add(instance);
        return instance;
    }

    /**
     * Freezes the accumulated state.
     *
     * @return immutable module
     */
    public Module build() {
        List<Instance> built = instances.stream().map(InstanceBuilder::build).toList();
        return new Module(name, toPorts(inputs), toPorts(outputs), arena, members, built);
    }

    private static List<Port> toPorts(List<PortEntry> entries) {
        return entries.stream()
            .map(entry -> new Port(entry.name, entry.direction, entry.width, entry.derived))
            .toList();
    }

    /**
     * Port under construction; its derived-net list grows during resolution.
     */
    public static final class PortEntry {
        private final String name;
        private final Direction direction;
        private final BitRange width;
        private final List<NetRef> derived = new ArrayList<>();

        private PortEntry(String name, Direction direction, BitRange width) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.direction = Objects.requireNonNull(direction, "direction must not be null");
            this.width = width;
        }

        public String name() {
            return name;
        }

        public Direction direction() {
            return direction;
        }

        public List<NetRef> derivedNets() {
            return List.copyOf(derived);
        }
    }
}
