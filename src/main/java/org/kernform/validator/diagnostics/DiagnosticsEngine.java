package org.kernform.validator.diagnostics;

import org.kernform.validator.api.ContractErrorCode;
import org.kernform.validator.internal.i18n.Messages;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostics while contracts and call sites are checked.
 * <p>
 * This decouples defect reporting from the rules that detect the defects. Messages are
 * rendered from the {@code contract_messages} bundle with the arguments
 * {@code {0}} subject, {@code {1}} argument index, {@code {2}} expected,
 * {@code {3}} actual and {@code {4}} candidate names.
 * <p>
 * Instances are not thread-safe; each check uses its own engine.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code The defect code.
     * @param subject The contract or invocation concerned.
     * @param argumentIndex The argument index, or {@link Diagnostic#NO_ARGUMENT}.
     * @param expected What was expected, may be {@code null}.
     * @param actual What was found, may be {@code null}.
     */
    public void reportError(ContractErrorCode code, String subject, int argumentIndex, Object expected, Object actual) {
        report(Diagnostic.Type.ERROR, code, subject, argumentIndex, expected, actual, List.of());
    }

    /**
     * Reports an error that names candidate contracts.
     *
     * @param code The defect code.
     * @param subject The invocation concerned.
     * @param candidates The candidate contract names.
     */
    public void reportError(ContractErrorCode code, String subject, List<String> candidates) {
        report(Diagnostic.Type.ERROR, code, subject, Diagnostic.NO_ARGUMENT, null, null, candidates);
    }

    /**
     * Reports a warning.
     *
     * @param code The finding code.
     * @param subject The contract or invocation concerned.
     * @param argumentIndex The argument index, or {@link Diagnostic#NO_ARGUMENT}.
     * @param expected What was expected, may be {@code null}.
     * @param actual What was found, may be {@code null}.
     */
    public void reportWarning(ContractErrorCode code, String subject, int argumentIndex, Object expected, Object actual) {
        report(Diagnostic.Type.WARNING, code, subject, argumentIndex, expected, actual, List.of());
    }

    /**
     * Adds already-built diagnostics, e.g. from a nested check.
     * @param others The diagnostics to add, in order.
     */
    public void addAll(Collection<Diagnostic> others) {
        diagnostics.addAll(others);
    }

    private void report(Diagnostic.Type type, ContractErrorCode code, String subject, int argumentIndex,
                        Object expected, Object actual, List<String> candidates) {
        String expectedText = expected == null ? null : expected.toString();
        String actualText = actual == null ? null : actual.toString();
        String message = Messages.forCode(code,
                subject,
                String.valueOf(argumentIndex),
                expectedText,
                actualText,
                String.join(", ", candidates));
        diagnostics.add(new Diagnostic(type, code, subject, argumentIndex, expectedText, actualText, candidates, message));
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Formats a list of diagnostics one per line.
     * @param diagnostics The diagnostics.
     * @return The formatted text.
     */
    public static String summarize(Collection<Diagnostic> diagnostics) {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
