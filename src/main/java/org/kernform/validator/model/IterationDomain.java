package org.kernform.validator.model;

/**
 * The iteration domain a kernel operates on.
 */
public enum IterationDomain {
    /** One vertical column of cells per iteration. */
    CELL_COLUMN,
    /** One degree of freedom per iteration. Built-ins always iterate over DOFs. */
    DOF,
    /** The whole (local) domain in a single call. */
    DOMAIN
}
