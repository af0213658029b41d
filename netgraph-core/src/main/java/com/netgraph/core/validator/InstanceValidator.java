package com.netgraph.core.validator;

import com.netgraph.core.model.Diagnostic;
import com.netgraph.core.model.DiagnosticKind;
import com.netgraph.core.model.Instance;
import com.netgraph.core.model.Module;
import com.netgraph.core.model.ModuleTemplate;
import com.netgraph.core.model.Pin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks instance pins against the port sets of the module templates.
 *
 * <p>An instance whose reference matches a template (case-insensitive) is valid when
 * every pin name is a declared port of that template. An instance with no matching
 * template is a leaf cell and always valid. Failures are reported, never thrown.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * InstanceValidator validator = new InstanceValidator(templates);
 * List<ValidationResult> failures = validator.validate(result.modules()).stream()
 *     .filter(r -> !r.isValid())
 *     .toList();
 * }</pre>
 */
public class InstanceValidator {

    private static final Logger log = LoggerFactory.getLogger(InstanceValidator.class);

    private final List<ModuleTemplate> templates;

    public InstanceValidator(List<ModuleTemplate> templates) {
        this.templates = List.copyOf(Objects.requireNonNull(templates, "templates must not be null"));
    }

    /**
     * Validates one instance.
     *
     * @param moduleName name of the enclosing module
     * @param instance instance to check
     * @return validation outcome
     */
    public ValidationResult validate(String moduleName, Instance instance) {
        Objects.requireNonNull(instance, "instance must not be null");

        Optional<ModuleTemplate> template = findTemplate(instance.refName());
        if (template.isEmpty()) {
            return new ValidationResult(moduleName, instance.name(), instance.refName(), false, List.of());
        }

        List<String> unknown = new ArrayList<>();
        for (Pin pin : instance.pins()) {
            if (!template.get().declaresPort(pin.name())) {
                unknown.add(pin.name());
            }
        }
        return new ValidationResult(moduleName, instance.name(), instance.refName(), true, unknown);
    }

    /**
     * Validates every instance of every module.
     *
     * @param modules parsed modules
     * @return one result per instance, in module then instance order
     */
    public List<ValidationResult> validate(List<Module> modules) {
        Objects.requireNonNull(modules, "modules must not be null");

        List<ValidationResult> results = new ArrayList<>();
        for (Module module : modules) {
            for (Instance instance : module.instances()) {
                ValidationResult result = validate(module.name(), instance);
                if (!result.isValid()) {
                    log.warn("Instance {} of {} in module {} uses undeclared pins {}",
                        result.instance(), result.refName(), module.name(), result.unknownPins());
                }
                results.add(result);
            }
        }
        log.info("Validated {} instances, {} failed", results.size(),
            results.stream().filter(r -> !r.isValid()).count());
        return results;
    }

    /**
     * Converts failed results into {@link DiagnosticKind#TEMPLATE_MISMATCH} diagnostics.
     *
     * @param results validation results
     * @return one diagnostic per failed instance
     */
    public static List<Diagnostic> toDiagnostics(List<ValidationResult> results) {
        return results.stream()
            .filter(result -> !result.isValid())
            .map(result -> new Diagnostic(DiagnosticKind.TEMPLATE_MISMATCH, result.module(),
                "Instance " + result.instance() + " of " + result.refName()
                    + " connects pins not declared by the module: " + String.join(", ", result.unknownPins()),
                0))
            .toList();
    }

    private Optional<ModuleTemplate> findTemplate(String refName) {
        return templates.stream().filter(template -> template.matches(refName)).findFirst();
    }
}
