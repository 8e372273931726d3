package org.kernform.validator.model;

import java.util.Objects;

/**
 * An actual argument supplied at a call site.
 * <p>
 * The call-site scanner may be unable to determine the kind or data type of an argument;
 * such components are {@code null} and act as wildcards during binding.
 *
 * @param name The opaque handle of the argument (usually its source text).
 * @param kind The known kind, or {@code null} if unresolved.
 * @param dataType The known data type, or {@code null} if unresolved.
 */
public record InvocationArgument(String name, ArgumentKind kind, DataType dataType) {

    public InvocationArgument {
        Objects.requireNonNull(name, "name");
    }

    public static InvocationArgument of(String name, ArgumentKind kind, DataType dataType) {
        return new InvocationArgument(name, kind, dataType);
    }

    public static InvocationArgument unresolved(String name) {
        return new InvocationArgument(name, null, null);
    }

    public boolean isKindKnown() {
        return kind != null;
    }

    public boolean isDataTypeKnown() {
        return dataType != null;
    }

    /**
     * Returns the known type as {@code KIND:TYPE}, with {@code ?} for unresolved parts.
     * @return The description.
     */
    public String describeType() {
        return (kind == null ? "?" : kind.name()) + ":" + (dataType == null ? "?" : dataType.name());
    }
}
