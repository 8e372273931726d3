package org.kernform.validator.rules.builtin;

import org.kernform.validator.api.ContractErrorCode;
import org.kernform.validator.diagnostics.Diagnostic;
import org.kernform.validator.diagnostics.DiagnosticsEngine;
import org.kernform.validator.model.IterationDomain;
import org.kernform.validator.model.KernelContract;
import org.kernform.validator.rules.IContractRule;

/**
 * Built-in bodies are generated as loops over degrees of freedom.
 */
public class BuiltInDomainRule implements IContractRule {

    @Override
    public void check(KernelContract contract, DiagnosticsEngine diagnostics) {
        if (contract.operatesOn() != IterationDomain.DOF) {
            diagnostics.reportError(ContractErrorCode.INVALID_BUILT_IN_DOMAIN, contract.name(), Diagnostic.NO_ARGUMENT,
                    IterationDomain.DOF, contract.operatesOn());
        }
    }
}
