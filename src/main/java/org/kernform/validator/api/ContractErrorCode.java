package org.kernform.validator.api;

/**
 * Defines unique, testable codes for every defect the validator can report.
 * This decouples the test logic from the translated diagnostic messages.
 */
public enum ContractErrorCode {
    // region Contract Errors
    /** An argument kind does not allow the declared access mode. */
    ILLEGAL_ACCESS_MODE,
    /** An argument is declared over a number of spaces that does not fit its kind. */
    SPACE_COUNT_MISMATCH,
    /** A built-in does not have exactly the expected number of writable field arguments. */
    INVALID_WRITE_COUNT,
    /** A built-in declares an operator argument. */
    OPERATOR_ARGUMENT_IN_BUILT_IN,
    /** A built-in declares a reduction on something other than a scalar. */
    REDUCTION_ON_NON_SCALAR,
    /** A built-in mixes a reduction with differently-permissioned writable fields. */
    CONFLICTING_REDUCTION_AND_WRITE,
    /** A built-in declares more than one reduction while those are rejected. */
    MULTIPLE_REDUCTIONS,
    /** The field arguments of a built-in live on different spaces. */
    SPACE_MISMATCH,
    /** A built-in neither writes a field nor reduces into a scalar. */
    NO_EFFECTIVE_OUTPUT,
    /** The field arguments of a built-in have different data types. */
    DATA_TYPE_MISMATCH,
    /** A built-in does not iterate over degrees of freedom. */
    INVALID_BUILT_IN_DOMAIN,
    // endregion

    // region Call-Site Errors
    /** No candidate contract takes the supplied number of arguments. */
    ARITY_MISMATCH,
    /** An actual argument's kind or data type does not match the formal argument. */
    TYPE_MISMATCH,
    /** More than one candidate contract matches the call. */
    AMBIGUOUS_INVOCATION,
    /** No contract with the called name is known. */
    UNKNOWN_KERNEL,
    /** The call binds to a contract that failed validation. */
    INVALID_CONTRACT_REFERENCE,
    // endregion

    // region Registry Warnings
    /** The same contract was registered twice. */
    DUPLICATE_CONTRACT
    // endregion
}
