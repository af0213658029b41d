package com.netgraph.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Complete module list produced by a parse or load, with its recoverable diagnostics.
 *
 * @param modules modules in source order
 * @param diagnostics recoverable findings in the order they were recorded
 */
public record NetlistResult(
    List<Module> modules,
    List<Diagnostic> diagnostics
) {
    /**
     * Compact constructor with validation.
     */
    public NetlistResult {
        Objects.requireNonNull(modules, "modules must not be null");
        modules = List.copyOf(modules);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Finds a module by name.
     *
     * @param name module name
     * @return matching module
     */
    public Optional<Module> findModule(String name) {
        return modules.stream().filter(module -> module.name().equals(name)).findFirst();
    }

    /**
     * Returns the diagnostics of one kind.
     *
     * @param kind diagnostic kind
     * @return matching diagnostics
     */
    public List<Diagnostic> diagnostics(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).toList();
    }

    /**
     * Returns whether any diagnostic was recorded.
     *
     * @return true if there are diagnostics
     */
    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
