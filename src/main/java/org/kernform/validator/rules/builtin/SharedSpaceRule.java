package org.kernform.validator.rules.builtin;

import org.kernform.validator.api.ContractErrorCode;
import org.kernform.validator.diagnostics.DiagnosticsEngine;
import org.kernform.validator.model.ArgumentDescriptor;
import org.kernform.validator.model.ArgumentKind;
import org.kernform.validator.model.BuiltInTag;
import org.kernform.validator.model.KernelContract;
import org.kernform.validator.model.SpaceRef;
import org.kernform.validator.rules.IContractRule;

/**
 * All field arguments of a built-in live on the space of its first field,
 * unless the built-in is a cross-space conversion.
 */
public class SharedSpaceRule implements IContractRule {

    @Override
    public void check(KernelContract contract, DiagnosticsEngine diagnostics) {
        if (contract.hasTag(BuiltInTag.CROSS_SPACE_CONVERSION)) {
            return;
        }
        SpaceRef expected = null;
        for (int i = 0; i < contract.arity(); i++) {
            ArgumentDescriptor arg = contract.arguments().get(i);
            // a field without a space is already reported as a space count mismatch
            if (arg.kind() != ArgumentKind.FIELD || arg.primarySpace() == null) {
                continue;
            }
            if (expected == null) {
                expected = arg.primarySpace();
            } else if (!expected.equals(arg.primarySpace())) {
                diagnostics.reportError(ContractErrorCode.SPACE_MISMATCH, contract.name(), i, expected, arg.primarySpace());
            }
        }
    }
}
