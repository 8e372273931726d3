package org.kernform.validator.rules.builtin;

import org.kernform.validator.api.ContractErrorCode;
import org.kernform.validator.diagnostics.Diagnostic;
import org.kernform.validator.diagnostics.DiagnosticsEngine;
import org.kernform.validator.model.AccessMode;
import org.kernform.validator.model.ArgumentKind;
import org.kernform.validator.model.BuiltInTag;
import org.kernform.validator.model.KernelContract;
import org.kernform.validator.rules.IContractRule;

/**
 * A built-in must produce something: a field (any field argument) or a reduction.
 * A pure reduction must actually reduce.
 */
public class EffectiveOutputRule implements IContractRule {

    @Override
    public void check(KernelContract contract, DiagnosticsEngine diagnostics) {
        boolean hasField = contract.arguments().stream().anyMatch(a -> a.kind() == ArgumentKind.FIELD);
        boolean hasReduction = contract.arguments().stream().anyMatch(a -> a.access() == AccessMode.SUM);

        boolean noOutput = contract.hasTag(BuiltInTag.PURE_REDUCTION)
                ? !hasReduction
                : !hasField && !hasReduction;
        if (noOutput) {
            diagnostics.reportError(ContractErrorCode.NO_EFFECTIVE_OUTPUT, contract.name(), Diagnostic.NO_ARGUMENT,
                    null, null);
        }
    }
}
