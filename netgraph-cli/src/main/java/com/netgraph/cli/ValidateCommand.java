package com.netgraph.cli;

import com.netgraph.core.config.NetgraphConfig;
import com.netgraph.core.error.NetlistException;
import com.netgraph.core.pipeline.NetlistPipeline;
import com.netgraph.core.pipeline.PipelineResult;
import com.netgraph.core.validator.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check instance pins against the port lists of the modules they reference.
 *
 * <p>Exits with 1 when any hierarchical instance connects a pin its module does not
 * declare.
 */
@Command(
    name = "validate",
    description = "Validate instance pins against module templates",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private ConfigOptions configOptions;

    @Parameters(index = "0", description = "Netlist source to validate")
    private Path netlist;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            NetgraphConfig config = configOptions.load().withParser(true, false);
            PipelineResult result = new NetlistPipeline(config).parse(netlist);

            List<ValidationResult> failures = result.validations().stream()
                .filter(validation -> !validation.isValid())
                .toList();
            long hierarchical = result.validations().stream().filter(ValidationResult::hierarchical).count();
            out.printf("Checked %d instances (%d hierarchical)%n", result.validations().size(), hierarchical);

            if (failures.isEmpty()) {
                out.println("✓ All instances match their module templates");
                return 0;
            }
            for (ValidationResult failure : failures) {
                err.printf("✗ %s: instance %s of %s uses undeclared pins %s%n",
                    failure.module(), failure.instance(), failure.refName(), failure.unknownPins());
            }
            return 1;
        } catch (NetlistException e) {
            log.error("Validation failed: {}", e.getMessage());
            err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }
}
