package org.kernform.validator.rules.builtin;

import org.kernform.validator.api.ContractErrorCode;
import org.kernform.validator.diagnostics.DiagnosticsEngine;
import org.kernform.validator.model.ArgumentDescriptor;
import org.kernform.validator.model.ArgumentKind;
import org.kernform.validator.model.BuiltInTag;
import org.kernform.validator.model.DataType;
import org.kernform.validator.model.KernelContract;
import org.kernform.validator.rules.IContractRule;

/**
 * Field arguments of a built-in share the data type of its first field.
 * Only conversion built-ins may mix real and integer fields.
 */
public class SharedDataTypeRule implements IContractRule {

    @Override
    public void check(KernelContract contract, DiagnosticsEngine diagnostics) {
        if (contract.hasTag(BuiltInTag.CROSS_SPACE_CONVERSION)) {
            return;
        }
        DataType expected = null;
        for (int i = 0; i < contract.arity(); i++) {
            ArgumentDescriptor arg = contract.arguments().get(i);
            if (arg.kind() != ArgumentKind.FIELD) {
                continue;
            }
            if (expected == null) {
                expected = arg.dataType();
            } else if (arg.dataType() != expected) {
                diagnostics.reportError(ContractErrorCode.DATA_TYPE_MISMATCH, contract.name(), i, expected, arg.dataType());
            }
        }
    }
}
