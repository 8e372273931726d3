package org.kernform.validator.model;

/**
 * How a kernel accesses one of its arguments.
 * Which modes are legal depends on the {@link ArgumentKind}.
 */
public enum AccessMode {
    /** Read only. */
    READ,
    /** Overwritten without being read. */
    WRITE,
    /** Read and then overwritten. */
    READWRITE,
    /** Accumulated in place (increment). */
    INC,
    /** Reduced across all iterations into a single result. */
    SUM;

    /**
     * Checks whether this mode modifies a field argument.
     * @return {@code true} for {@link #WRITE}, {@link #READWRITE} and {@link #INC}.
     */
    public boolean isFieldWrite() {
        return this == WRITE || this == READWRITE || this == INC;
    }
}
