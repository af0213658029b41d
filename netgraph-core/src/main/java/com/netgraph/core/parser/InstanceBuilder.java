package com.netgraph.core.parser;

import com.netgraph.core.model.CellType;
import com.netgraph.core.model.Direction;
import com.netgraph.core.model.Instance;
import com.netgraph.core.model.NetRef;
import com.netgraph.core.model.Pin;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Mutable accumulator for one {@link Instance}'s pins.
 */
public final class InstanceBuilder {

    private final String name;
    private final String refName;
    private final CellType cellType;
    private final List<Pin> pins = new ArrayList<>();

    InstanceBuilder(String name, String refName, CellType cellType) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.refName = Objects.requireNonNull(refName, "refName must not be null");
        this.cellType = Objects.requireNonNull(cellType, "cellType must not be null");
    }

    public String name() {
        return name;
    }

    public String refName() {
        return refName;
    }

    /**
     * Appends a pin with unknown direction.
     *
     * @param pinName pin name
     * @param net connected net, null when unresolved
     */
    public void addPin(String pinName, NetRef net) {
        addPin(pinName, null, net);
    }

    /**
     * Appends a pin.
     *
     * @param pinName pin name
     * @param direction pin direction, null when unknown
     * @param net connected net, null when unresolved
     */
    public void addPin(String pinName, Direction direction, NetRef net) {
        pins.add(new Pin(pinName, direction, name, net));
    }

    Instance build() {
        return new Instance(name, refName, cellType, pins);
    }
}
