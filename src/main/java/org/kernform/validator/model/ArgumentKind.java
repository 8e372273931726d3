package org.kernform.validator.model;

/**
 * The kind of a declared kernel argument.
 */
public enum ArgumentKind {
    /** A field defined over exactly one function space. */
    FIELD(1),
    /** A single value, not defined over any space. */
    SCALAR(0),
    /** A linear-operator-like argument coupling a "to" space and a "from" space. */
    OPERATOR(2);

    private final int spaceCount;

    ArgumentKind(int spaceCount) {
        this.spaceCount = spaceCount;
    }

    /**
     * Returns the number of function spaces an argument of this kind is declared over.
     * @return 0 for scalars, 1 for fields, 2 for operators.
     */
    public int spaceCount() {
        return spaceCount;
    }
}
