package com.netgraph.core.validator;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of checking one instance against the module templates.
 *
 * @param module name of the module containing the instance
 * @param instance instance name
 * @param refName referenced module or cell
 * @param hierarchical whether a template matched the reference
 * @param unknownPins pin names the matching template does not declare, in pin order
 */
public record ValidationResult(
    String module,
    String instance,
    String refName,
    boolean hierarchical,
    List<String> unknownPins
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationResult {
        Objects.requireNonNull(instance, "instance must not be null");
        Objects.requireNonNull(refName, "refName must not be null");
        unknownPins = unknownPins == null ? List.of() : List.copyOf(unknownPins);
    }

    /**
     * Returns whether every pin is declared by the template (always true for leaf cells).
     *
     * @return true if valid
     */
    public boolean isValid() {
        return unknownPins.isEmpty();
    }
}
