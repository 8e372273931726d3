package org.kernform.validator.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One declared argument of a kernel contract.
 * <p>
 * The number of spaces is not checked against the kind here: a mismatch is representable
 * and is reported as a diagnostic by the access-mode rules.
 *
 * @param kind The argument kind.
 * @param dataType The intrinsic data type.
 * @param access The declared access mode.
 * @param spaces The function spaces, in declaration order (operators: "to" space first).
 */
public record ArgumentDescriptor(
        ArgumentKind kind,
        DataType dataType,
        AccessMode access,
        List<SpaceRef> spaces
) {

    /** The maximum number of spaces any argument can be declared over. */
    public static final int MAX_SPACES = 2;

    public ArgumentDescriptor {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(dataType, "dataType");
        Objects.requireNonNull(access, "access");
        spaces = List.copyOf(Objects.requireNonNull(spaces, "spaces"));
        if (spaces.size() > MAX_SPACES) {
            throw new IllegalArgumentException("An argument is declared over at most " + MAX_SPACES
                    + " spaces, got " + spaces.size());
        }
    }

    /**
     * Creates a field argument.
     * @param dataType The data type.
     * @param access The access mode.
     * @param space The space the field lives on.
     * @return The descriptor.
     */
    public static ArgumentDescriptor field(DataType dataType, AccessMode access, String space) {
        return new ArgumentDescriptor(ArgumentKind.FIELD, dataType, access, List.of(SpaceRef.of(space)));
    }

    /**
     * Creates a scalar argument.
     * @param dataType The data type.
     * @param access The access mode.
     * @return The descriptor.
     */
    public static ArgumentDescriptor scalar(DataType dataType, AccessMode access) {
        return new ArgumentDescriptor(ArgumentKind.SCALAR, dataType, access, List.of());
    }

    /**
     * Creates an operator argument.
     * @param dataType The data type.
     * @param access The access mode.
     * @param toSpace The space the operator maps to.
     * @param fromSpace The space the operator maps from.
     * @return The descriptor.
     */
    public static ArgumentDescriptor operator(DataType dataType, AccessMode access, String toSpace, String fromSpace) {
        return new ArgumentDescriptor(ArgumentKind.OPERATOR, dataType, access,
                List.of(SpaceRef.of(toSpace), SpaceRef.of(fromSpace)));
    }

    /**
     * Returns the first declared space, if any.
     * @return The space, or {@code null} for arguments declared without spaces.
     */
    public SpaceRef primarySpace() {
        return spaces.isEmpty() ? null : spaces.get(0);
    }

    /**
     * Checks whether this is a field argument that the kernel modifies.
     * @return {@code true} for fields with WRITE, READWRITE or INC access.
     */
    public boolean isWritableField() {
        return kind == ArgumentKind.FIELD && access.isFieldWrite();
    }

    /**
     * Returns a compact signature such as {@code FIELD:REAL:WRITE@w1}.
     * @return The signature text.
     */
    public String signature() {
        String base = kind + ":" + dataType + ":" + access;
        if (spaces.isEmpty()) {
            return base;
        }
        return base + "@" + spaces.stream().map(SpaceRef::id).collect(Collectors.joining(","));
    }

    @Override
    public String toString() {
        return signature();
    }
}
