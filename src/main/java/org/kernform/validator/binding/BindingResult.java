package org.kernform.validator.binding;

import org.kernform.validator.diagnostics.Diagnostic;
import org.kernform.validator.model.KernelContract;

import java.util.List;
import java.util.Objects;

/**
 * The outcome of binding one invocation against its candidate contracts.
 * Code generation may only proceed on {@link Bound}.
 */
public sealed interface BindingResult permits BindingResult.Bound, BindingResult.Rejected {

    /**
     * Checks whether the invocation was bound.
     * @return {@code true} for {@link Bound}.
     */
    default boolean isBound() {
        return this instanceof Bound;
    }

    /**
     * The invocation matches exactly one contract.
     * @param contract The selected contract.
     * @param mapping The positional pairing of formal to actual arguments.
     */
    record Bound(KernelContract contract, List<BoundArgument> mapping) implements BindingResult {
        public Bound {
            Objects.requireNonNull(contract, "contract");
            mapping = List.copyOf(mapping);
        }
    }

    /**
     * The invocation could not be bound.
     * @param diagnostics Why, in report order. Never empty.
     */
    record Rejected(List<Diagnostic> diagnostics) implements BindingResult {
        public Rejected {
            diagnostics = List.copyOf(diagnostics);
            if (diagnostics.isEmpty()) {
                throw new IllegalArgumentException("A rejected binding must carry at least one diagnostic");
            }
        }
    }
}
