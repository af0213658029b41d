package com.netgraph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Name and port signature of a module, produced by the template pass and used to
 * classify and validate instances.
 *
 * @param name module name
 * @param inputs input ports
 * @param outputs output ports
 */
public record ModuleTemplate(
    String name,
    List<TemplatePort> inputs,
    List<TemplatePort> outputs
) {
    /**
     * Compact constructor with validation.
     */
    public ModuleTemplate {
        Objects.requireNonNull(name, "name must not be null");
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    /**
     * Returns the ports of one direction.
     *
     * @param direction port direction
     * @return ports in declaration order
     */
    public List<TemplatePort> ports(Direction direction) {
        return direction == Direction.INPUT ? inputs : outputs;
    }

    /**
     * Returns whether this template names the given module, ignoring case.
     *
     * @param refName referenced name from an instance
     * @return true if the names match case-insensitively
     */
    public boolean matches(String refName) {
        return name.equalsIgnoreCase(refName);
    }

    /**
     * Returns whether a port of either direction has the given exact name.
     *
     * @param portName port name
     * @return true if declared
     */
    public boolean declaresPort(String portName) {
        return inputs.stream().anyMatch(port -> port.name().equals(portName))
            || outputs.stream().anyMatch(port -> port.name().equals(portName));
    }
}
