package org.kernform.validator.rules;

import org.kernform.validator.diagnostics.DiagnosticsEngine;
import org.kernform.validator.model.KernelContract;

/**
 * A single structural check on a kernel contract.
 * Rules are stateless and report every violation they find rather than stopping at the first.
 */
@FunctionalInterface
public interface IContractRule {
    /**
     * Checks one contract.
     * @param contract The contract to check.
     * @param diagnostics The engine for reporting violations.
     */
    void check(KernelContract contract, DiagnosticsEngine diagnostics);
}
