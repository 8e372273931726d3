package org.kernform.validator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The declared argument contract of a kernel or library built-in.
 * <p>
 * All fields are supplied explicitly at construction; there are no inherited defaults.
 * Instances are immutable and safe to share between threads.
 *
 * @param name The kernel name.
 * @param arguments The declared arguments in positional order. Never empty.
 * @param operatesOn The iteration domain.
 * @param builtIn Whether this is a library built-in whose body is generated.
 * @param tags Markers relaxing individual built-in rules.
 */
public record KernelContract(
        String name,
        List<ArgumentDescriptor> arguments,
        IterationDomain operatesOn,
        boolean builtIn,
        Set<BuiltInTag> tags
) {

    public KernelContract {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(operatesOn, "operatesOn");
        arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments"));
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("Kernel '" + name + "' must declare at least one argument");
        }
        tags = tags == null || tags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(tags));
    }

    /**
     * Starts a builder for a user kernel contract.
     * @param name The kernel name.
     * @return A new builder.
     */
    public static Builder kernel(String name) {
        return new Builder(name, false).operatesOn(IterationDomain.CELL_COLUMN);
    }

    /**
     * Starts a builder for a built-in contract.
     * @param name The built-in name.
     * @return A new builder.
     */
    public static Builder builtIn(String name) {
        return new Builder(name, true).operatesOn(IterationDomain.DOF);
    }

    /**
     * Returns the number of declared arguments.
     * @return The arity.
     */
    public int arity() {
        return arguments.size();
    }

    /**
     * Checks whether the given tag is present.
     * @param tag The tag.
     * @return {@code true} if tagged.
     */
    public boolean hasTag(BuiltInTag tag) {
        return tags.contains(tag);
    }

    /**
     * Returns the signature, e.g. {@code aX_plus_Y(FIELD:REAL:WRITE@any_space_1, ...)}.
     * @return The signature text.
     */
    public String signature() {
        return name + arguments.stream()
                .map(ArgumentDescriptor::signature)
                .collect(Collectors.joining(", ", "(", ")"));
    }

    /**
     * Fluent builder for {@link KernelContract}.
     */
    public static final class Builder {
        private final String name;
        private final boolean builtIn;
        private final List<ArgumentDescriptor> arguments = new ArrayList<>();
        private final Set<BuiltInTag> tags = EnumSet.noneOf(BuiltInTag.class);
        private IterationDomain operatesOn;

        private Builder(String name, boolean builtIn) {
            this.name = name;
            this.builtIn = builtIn;
        }

        public Builder arg(ArgumentDescriptor argument) {
            arguments.add(argument);
            return this;
        }

        public Builder field(DataType dataType, AccessMode access, String space) {
            return arg(ArgumentDescriptor.field(dataType, access, space));
        }

        public Builder scalar(DataType dataType, AccessMode access) {
            return arg(ArgumentDescriptor.scalar(dataType, access));
        }

        public Builder operator(DataType dataType, AccessMode access, String toSpace, String fromSpace) {
            return arg(ArgumentDescriptor.operator(dataType, access, toSpace, fromSpace));
        }

        public Builder operatesOn(IterationDomain domain) {
            this.operatesOn = domain;
            return this;
        }

        public Builder tag(BuiltInTag tag) {
            tags.add(tag);
            return this;
        }

        public KernelContract build() {
            return new KernelContract(name, arguments, operatesOn, builtIn, tags);
        }
    }
}
