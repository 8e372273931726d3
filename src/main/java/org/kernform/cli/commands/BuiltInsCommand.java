package org.kernform.cli.commands;

import org.kernform.validator.model.BuiltInTag;
import org.kernform.validator.model.KernelContract;
import org.kernform.validator.registry.BuiltInCatalog;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(name = "builtins", description = "Lists the standard built-ins and their argument contracts.")
public class BuiltInsCommand implements Callable<Integer> {

    @Option(names = {"-n", "--name"}, description = "Only list built-ins whose name contains this text (case-insensitive).")
    private String nameFilter;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        String filter = nameFilter == null ? null : nameFilter.toLowerCase(Locale.ROOT);
        int listed = 0;
        for (KernelContract builtIn : BuiltInCatalog.standard()) {
            if (filter != null && !builtIn.name().toLowerCase(Locale.ROOT).contains(filter)) {
                continue;
            }
            String tags = builtIn.tags().isEmpty()
                    ? ""
                    : builtIn.tags().stream().map(BuiltInTag::name).collect(Collectors.joining(", ", " [", "]"));
            out.println(builtIn.signature() + tags);
            listed++;
        }
        if (listed == 0) {
            out.println("No built-in matches '" + nameFilter + "'.");
            return 1;
        }
        return 0;
    }
}
