package org.kernform.validator.model;

/**
 * Explicit markers that relax individual built-in shape rules.
 */
public enum BuiltInTag {
    /**
     * The built-in converts between spaces or data types (e.g. an integer-to-real field cast),
     * so its field arguments need not share a space or a data type.
     */
    CROSS_SPACE_CONVERSION,
    /**
     * The built-in is a pure reduction into a scalar and writes no field.
     */
    PURE_REDUCTION
}
