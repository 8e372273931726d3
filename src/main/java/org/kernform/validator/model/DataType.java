package org.kernform.validator.model;

/**
 * The intrinsic data type of a kernel argument.
 */
public enum DataType {
    REAL,
    INTEGER,
    LOGICAL
}
