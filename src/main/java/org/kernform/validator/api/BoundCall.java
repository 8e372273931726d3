package org.kernform.validator.api;

import org.kernform.validator.binding.BindingResult;

/**
 * A kernel call that was bound to a valid contract and may be handed to code generation.
 *
 * @param invokeName The invoke containing the call.
 * @param callIndex The zero-based position of the call inside the invoke.
 * @param binding The binding.
 */
public record BoundCall(String invokeName, int callIndex, BindingResult.Bound binding) {
}
