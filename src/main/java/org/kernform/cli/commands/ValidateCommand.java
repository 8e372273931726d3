package org.kernform.cli.commands;

import com.typesafe.config.ConfigException;
import org.kernform.cli.CommandLineInterface;
import org.kernform.validator.ContractValidator;
import org.kernform.validator.api.ValidationException;
import org.kernform.validator.api.ValidationReport;
import org.kernform.validator.config.ValidatorOptions;
import org.kernform.validator.io.CompilationUnitReader;
import org.kernform.validator.io.ReportWriter;
import org.kernform.validator.model.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(name = "validate", description = "Validates the kernel contracts and invokes of a compilation unit (JSON).")
public class ValidateCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ValidateCommand.class);

    /** Exit code when the unit validated without errors. */
    public static final int EXIT_OK = 0;
    /** Exit code when the unit has at least one error. */
    public static final int EXIT_DEFECTS = 1;
    /** Exit code when the unit could not be read or validated. */
    public static final int EXIT_FAILURE = 2;

    @Option(names = {"-f", "--file"}, required = true, description = "The compilation unit JSON file.")
    private File file;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
    private ReportWriter.Format format = ReportWriter.Format.TEXT;

    @Option(names = {"-p", "--parallelism"}, description = "Worker threads (overrides kernform.validator.parallelism).")
    private Integer parallelism;

    @Option(names = "--no-standard-builtins", description = "Do not register the standard built-in catalog.")
    private boolean noStandardBuiltIns;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        ValidatorOptions options;
        try {
            options = ValidatorOptions.fromConfig(parent.getConfig());
            if (parallelism != null) {
                options = options.withParallelism(parallelism);
            }
            if (noStandardBuiltIns) {
                options = options.withStandardBuiltIns(false);
            }
        } catch (ConfigException | IllegalArgumentException e) {
            spec.commandLine().getErr().println("Invalid validator configuration: " + e.getMessage());
            return EXIT_FAILURE;
        }

        try {
            CompilationUnit unit = new CompilationUnitReader().read(file.toPath());
            ValidationReport report = new ContractValidator(options).validate(unit);
            new ReportWriter().write(report, format, spec.commandLine().getOut());
            return report.hasErrors() ? EXIT_DEFECTS : EXIT_OK;
        } catch (ValidationException e) {
            LOG.debug("Validation of '{}' failed", file, e);
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }
}
