package com.netgraph.core.pipeline;

import com.netgraph.core.model.Diagnostic;
import com.netgraph.core.model.Module;
import com.netgraph.core.model.ModuleTemplate;
import com.netgraph.core.model.NetlistResult;
import com.netgraph.core.validator.InstanceValidator;
import com.netgraph.core.validator.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a read: the modules plus everything learned while producing them.
 *
 * @param netlist parsed or reloaded modules with their diagnostics
 * @param templates module templates, empty when the modules were reloaded from JSON
 * @param validations instance validation results, empty when validation did not run
 * @param reloaded whether the modules came from an existing JSON exchange file
 */
public record PipelineResult(
    NetlistResult netlist,
    List<ModuleTemplate> templates,
    List<ValidationResult> validations,
    boolean reloaded
) {
    /**
     * Compact constructor with validation.
     */
    public PipelineResult {
        Objects.requireNonNull(netlist, "netlist must not be null");
        templates = templates == null ? List.of() : List.copyOf(templates);
        validations = validations == null ? List.of() : List.copyOf(validations);
    }

    public List<Module> modules() {
        return netlist.modules();
    }

    /**
     * Returns parse or reload diagnostics followed by template mismatches.
     *
     * @return all recoverable findings
     */
    public List<Diagnostic> allDiagnostics() {
        List<Diagnostic> all = new ArrayList<>(netlist.diagnostics());
        all.addAll(InstanceValidator.toDiagnostics(validations));
        return all;
    }
}
