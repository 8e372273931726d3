package org.kernform.validator.model;

import java.util.List;
import java.util.Objects;

/**
 * One kernel call inside an invoke.
 *
 * @param kernelName The name of the called kernel or built-in.
 * @param arguments The actual arguments in positional order.
 */
public record KernelCall(String kernelName, List<InvocationArgument> arguments) {

    public KernelCall {
        Objects.requireNonNull(kernelName, "kernelName");
        arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments"));
    }
}
