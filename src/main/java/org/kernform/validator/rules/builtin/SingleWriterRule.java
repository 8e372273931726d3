package org.kernform.validator.rules.builtin;

import org.kernform.validator.api.ContractErrorCode;
import org.kernform.validator.diagnostics.Diagnostic;
import org.kernform.validator.diagnostics.DiagnosticsEngine;
import org.kernform.validator.model.ArgumentDescriptor;
import org.kernform.validator.model.ArgumentKind;
import org.kernform.validator.model.BuiltInTag;
import org.kernform.validator.model.KernelContract;
import org.kernform.validator.rules.IContractRule;

/**
 * A built-in with field arguments writes exactly one of them.
 * Built-ins tagged {@link BuiltInTag#PURE_REDUCTION} write none.
 */
public class SingleWriterRule implements IContractRule {

    @Override
    public void check(KernelContract contract, DiagnosticsEngine diagnostics) {
        int fields = 0;
        int writers = 0;
        for (ArgumentDescriptor arg : contract.arguments()) {
            if (arg.kind() == ArgumentKind.FIELD) {
                fields++;
                if (arg.access().isFieldWrite()) {
                    writers++;
                }
            }
        }
        if (fields == 0) {
            return;
        }
        int expected = contract.hasTag(BuiltInTag.PURE_REDUCTION) ? 0 : 1;
        if (writers != expected) {
            diagnostics.reportError(ContractErrorCode.INVALID_WRITE_COUNT, contract.name(),
                    Diagnostic.NO_ARGUMENT, expected, writers);
        }
    }
}
