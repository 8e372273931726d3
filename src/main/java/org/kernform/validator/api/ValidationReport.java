package org.kernform.validator.api;

import org.kernform.validator.diagnostics.Diagnostic;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything the validator found in one compilation unit.
 *
 * @param unitName The name of the validated unit.
 * @param diagnostics All diagnostics: contract defects in registry order, then call-site defects in invoke order.
 * @param boundCalls The calls that may proceed to code generation.
 * @param rejectedContracts Signatures of the contracts that failed validation, in registry order.
 */
public record ValidationReport(
        String unitName,
        List<Diagnostic> diagnostics,
        List<BoundCall> boundCalls,
        Set<String> rejectedContracts
) {

    public ValidationReport {
        diagnostics = List.copyOf(diagnostics);
        boundCalls = List.copyOf(boundCalls);
        rejectedContracts = Collections.unmodifiableSet(new LinkedHashSet<>(rejectedContracts));
    }

    /**
     * Checks if any error was reported.
     * @return {@code true} if at least one diagnostic is an error.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns the number of errors.
     * @return The error count.
     */
    public long errorCount() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
    }

    /**
     * Returns the number of warnings.
     * @return The warning count.
     */
    public long warningCount() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.WARNING).count();
    }
}
