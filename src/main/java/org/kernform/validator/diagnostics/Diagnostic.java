package org.kernform.validator.diagnostics;

import org.kernform.validator.api.ContractErrorCode;

import java.util.List;
import java.util.Objects;

/**
 * Represents a single defect (error or warning) found in a contract or at a call site.
 *
 * @param type The severity of the diagnostic.
 * @param code The testable defect code.
 * @param subject The contract or invocation the defect belongs to.
 * @param argumentIndex The zero-based argument position, or {@link #NO_ARGUMENT} for whole-contract defects.
 * @param expected What the rule expected, or {@code null} if not applicable.
 * @param actual What was found, or {@code null} if not applicable.
 * @param candidates Candidate contract names involved (ambiguous invocations), otherwise empty.
 * @param message The human-readable message.
 */
public record Diagnostic(
        Type type,
        ContractErrorCode code,
        String subject,
        int argumentIndex,
        String expected,
        String actual,
        List<String> candidates,
        String message
) {
    /** Argument index used for defects that concern a whole contract or call. */
    public static final int NO_ARGUMENT = -1;

    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A defect that excludes the contract or call from code generation. */
        ERROR,
        /** A finding that does not prevent code generation. */
        WARNING
    }

    public Diagnostic {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(code, "code");
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    /**
     * Checks whether this diagnostic is pinned to a specific argument.
     * @return {@code true} if an argument index is set.
     */
    public boolean hasArgumentIndex() {
        return argumentIndex != NO_ARGUMENT;
    }

    @Override
    public String toString() {
        if (hasArgumentIndex()) {
            return String.format("[%s] %s[%d]: %s: %s", type, subject, argumentIndex, code, message);
        }
        return String.format("[%s] %s: %s: %s", type, subject, code, message);
    }
}
