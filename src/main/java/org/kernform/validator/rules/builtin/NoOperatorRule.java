package org.kernform.validator.rules.builtin;

import org.kernform.validator.api.ContractErrorCode;
import org.kernform.validator.diagnostics.DiagnosticsEngine;
import org.kernform.validator.model.ArgumentKind;
import org.kernform.validator.model.KernelContract;
import org.kernform.validator.rules.IContractRule;

/**
 * Built-ins have no kernel body to apply an operator in, so they may not take one.
 */
public class NoOperatorRule implements IContractRule {

    @Override
    public void check(KernelContract contract, DiagnosticsEngine diagnostics) {
        for (int i = 0; i < contract.arity(); i++) {
            if (contract.arguments().get(i).kind() == ArgumentKind.OPERATOR) {
                diagnostics.reportError(ContractErrorCode.OPERATOR_ARGUMENT_IN_BUILT_IN, contract.name(), i,
                        null, ArgumentKind.OPERATOR);
            }
        }
    }
}
