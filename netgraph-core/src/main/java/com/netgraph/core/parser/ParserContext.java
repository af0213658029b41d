package com.netgraph.core.parser;

import com.netgraph.core.model.Diagnostic;
import com.netgraph.core.model.DiagnosticKind;
import com.netgraph.core.model.Module;
import com.netgraph.core.model.ModuleTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Explicit state of one body pass: the open module, the open instance, the
 * module/endmodule tallies and the diagnostics collected so far.
 *
 * <p>Created per parse; never shared between parses.
 */
final class ParserContext {

    private final List<ModuleBuilder> modules = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private ModuleBuilder currentModule;
    private InstanceBuilder currentInstance;
    private ModuleTemplate currentTemplate;
    private int moduleCount;
    private int endModuleCount;
    private int lineNumber;

    void advance(int line) {
        this.lineNumber = line;
    }

    int lineNumber() {
        return lineNumber;
    }

    ModuleBuilder openModule(String name) {
        moduleCount++;
        currentModule = new ModuleBuilder(name);
        closeInstance();
        modules.add(currentModule);
        return currentModule;
    }

    void closeModule() {
        endModuleCount++;
        currentModule = null;
        closeInstance();
    }

    boolean inModule() {
        return currentModule != null;
    }

    ModuleBuilder currentModule() {
        return currentModule;
    }

    void openInstance(InstanceBuilder instance, ModuleTemplate template) {
        currentInstance = instance;
        currentTemplate = template;
    }

    void closeInstance() {
        currentInstance = null;
        currentTemplate = null;
    }

    boolean insideInstance() {
        return currentInstance != null;
    }

    InstanceBuilder currentInstance() {
        return currentInstance;
    }

    /**
     * Template of the open instance's reference, null for leaf cells.
     */
    ModuleTemplate currentTemplate() {
        return currentTemplate;
    }

    int moduleCount() {
        return moduleCount;
    }

    int endModuleCount() {
        return endModuleCount;
    }

    void report(DiagnosticKind kind, String message) {
        String module = currentModule == null ? null : currentModule.name();
        diagnostics.add(new Diagnostic(kind, module, message, lineNumber));
    }

    List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    List<Module> buildModules() {
        return modules.stream().map(ModuleBuilder::build).toList();
    }
}
