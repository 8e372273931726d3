package org.kernform.validator.rules.builtin;

import org.kernform.validator.api.ContractErrorCode;
import org.kernform.validator.diagnostics.DiagnosticsEngine;
import org.kernform.validator.model.AccessMode;
import org.kernform.validator.model.ArgumentDescriptor;
import org.kernform.validator.model.ArgumentKind;
import org.kernform.validator.model.KernelContract;
import org.kernform.validator.rules.IContractRule;

import java.util.List;

/**
 * Keeps reductions in built-ins simple.
 * <ul>
 *     <li>Only scalars can be reduced.</li>
 *     <li>A reduction may be fused with writes to fields only if all written fields share one access mode,
 *     e.g. one SUM scalar with one READWRITE field is fine, but SUM with a READWRITE and a WRITE field is not.</li>
 *     <li>Optionally, at most one reduction per built-in.</li>
 * </ul>
 */
public class ReductionIsolationRule implements IContractRule {

    private final boolean rejectMultipleReductions;

    public ReductionIsolationRule(boolean rejectMultipleReductions) {
        this.rejectMultipleReductions = rejectMultipleReductions;
    }

    @Override
    public void check(KernelContract contract, DiagnosticsEngine diagnostics) {
        List<ArgumentDescriptor> args = contract.arguments();
        boolean hasReduction = args.stream().anyMatch(a -> a.access() == AccessMode.SUM);
        if (!hasReduction) {
            return;
        }

        for (int i = 0; i < args.size(); i++) {
            ArgumentDescriptor arg = args.get(i);
            if (arg.access() == AccessMode.SUM && arg.kind() != ArgumentKind.SCALAR) {
                diagnostics.reportError(ContractErrorCode.REDUCTION_ON_NON_SCALAR, contract.name(), i,
                        ArgumentKind.SCALAR, arg.kind());
            }
        }

        AccessMode firstWrite = null;
        for (int i = 0; i < args.size(); i++) {
            ArgumentDescriptor arg = args.get(i);
            if (!arg.isWritableField()) {
                continue;
            }
            if (firstWrite == null) {
                firstWrite = arg.access();
            } else if (arg.access() != firstWrite) {
                diagnostics.reportError(ContractErrorCode.CONFLICTING_REDUCTION_AND_WRITE, contract.name(), i,
                        firstWrite, arg.access());
                break;
            }
        }

        if (rejectMultipleReductions) {
            boolean seen = false;
            for (int i = 0; i < args.size(); i++) {
                if (args.get(i).access() != AccessMode.SUM) {
                    continue;
                }
                if (seen) {
                    diagnostics.reportError(ContractErrorCode.MULTIPLE_REDUCTIONS, contract.name(), i, 1, null);
                }
                seen = true;
            }
        }
    }
}
