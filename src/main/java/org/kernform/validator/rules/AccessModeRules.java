package org.kernform.validator.rules;

import org.kernform.validator.api.ContractErrorCode;
import org.kernform.validator.diagnostics.Diagnostic;
import org.kernform.validator.diagnostics.DiagnosticsEngine;
import org.kernform.validator.model.AccessMode;
import org.kernform.validator.model.ArgumentDescriptor;
import org.kernform.validator.model.ArgumentKind;
import org.kernform.validator.model.KernelContract;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides which access modes each argument kind allows, and checks every argument of a
 * contract against that table. Applies to user kernels and built-ins alike.
 *
 * <pre>
 * FIELD    : READ, WRITE, READWRITE, INC
 * SCALAR   : READ, SUM
 * OPERATOR : READ
 * </pre>
 */
public class AccessModeRules implements IContractRule {

    private static final Map<ArgumentKind, Set<AccessMode>> LEGAL_ACCESSES = new EnumMap<>(ArgumentKind.class);

    static {
        LEGAL_ACCESSES.put(ArgumentKind.FIELD, Collections.unmodifiableSet(
                EnumSet.of(AccessMode.READ, AccessMode.WRITE, AccessMode.READWRITE, AccessMode.INC)));
        LEGAL_ACCESSES.put(ArgumentKind.SCALAR, Collections.unmodifiableSet(
                EnumSet.of(AccessMode.READ, AccessMode.SUM)));
        LEGAL_ACCESSES.put(ArgumentKind.OPERATOR, Collections.unmodifiableSet(
                EnumSet.of(AccessMode.READ)));
    }

    /**
     * Checks whether an argument of the given kind may be declared with the given access.
     * Total over all pairs; {@code null} inputs are simply illegal.
     *
     * @param kind The argument kind.
     * @param access The access mode.
     * @return {@code true} if the combination is legal.
     */
    public static boolean isLegalAccess(ArgumentKind kind, AccessMode access) {
        if (kind == null || access == null) {
            return false;
        }
        return LEGAL_ACCESSES.get(kind).contains(access);
    }

    /**
     * Validates every argument of a contract.
     * @param contract The contract.
     * @return The diagnostics in ascending argument order; empty if the contract is clean.
     */
    public List<Diagnostic> validateContract(KernelContract contract) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        check(contract, diagnostics);
        return diagnostics.getDiagnostics();
    }

    @Override
    public void check(KernelContract contract, DiagnosticsEngine diagnostics) {
        List<ArgumentDescriptor> arguments = contract.arguments();
        for (int i = 0; i < arguments.size(); i++) {
            ArgumentDescriptor arg = arguments.get(i);
            if (!isLegalAccess(arg.kind(), arg.access())) {
                diagnostics.reportError(ContractErrorCode.ILLEGAL_ACCESS_MODE, contract.name(), i, arg.kind(), arg.access());
            }
            int expectedSpaces = arg.kind().spaceCount();
            if (arg.spaces().size() != expectedSpaces) {
                diagnostics.reportError(ContractErrorCode.SPACE_COUNT_MISMATCH, contract.name(), i,
                        expectedSpaces, arg.spaces().size());
            }
        }
    }
}
