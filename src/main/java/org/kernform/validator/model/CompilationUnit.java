package org.kernform.validator.model;

import java.util.List;
import java.util.Objects;

/**
 * Everything the validator sees of one compilation unit: the declared contracts
 * and the invokes that call them.
 *
 * @param name The unit name, used in log output and reports.
 * @param contracts The kernel contracts declared in or imported into the unit.
 * @param invokes The invokes found by the call-site scanner.
 */
public record CompilationUnit(String name, List<KernelContract> contracts, List<Invoke> invokes) {

    public CompilationUnit {
        Objects.requireNonNull(name, "name");
        contracts = List.copyOf(Objects.requireNonNull(contracts, "contracts"));
        invokes = List.copyOf(Objects.requireNonNull(invokes, "invokes"));
    }
}
