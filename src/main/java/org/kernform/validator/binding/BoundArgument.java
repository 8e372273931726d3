package org.kernform.validator.binding;

import org.kernform.validator.model.ArgumentDescriptor;
import org.kernform.validator.model.InvocationArgument;

/**
 * Pairs one formal argument of a contract with the actual argument bound to it.
 *
 * @param index The zero-based position.
 * @param formal The declared argument.
 * @param actual The call-site argument.
 */
public record BoundArgument(int index, ArgumentDescriptor formal, InvocationArgument actual) {
}
