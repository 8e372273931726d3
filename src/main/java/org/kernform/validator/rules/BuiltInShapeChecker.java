package org.kernform.validator.rules;

import org.kernform.validator.diagnostics.Diagnostic;
import org.kernform.validator.diagnostics.DiagnosticsEngine;
import org.kernform.validator.model.KernelContract;
import org.kernform.validator.rules.builtin.BuiltInDomainRule;
import org.kernform.validator.rules.builtin.EffectiveOutputRule;
import org.kernform.validator.rules.builtin.NoOperatorRule;
import org.kernform.validator.rules.builtin.ReductionIsolationRule;
import org.kernform.validator.rules.builtin.SharedDataTypeRule;
import org.kernform.validator.rules.builtin.SharedSpaceRule;
import org.kernform.validator.rules.builtin.SingleWriterRule;

import java.util.List;

/**
 * Checks the structural invariants that only library built-ins are held to.
 * <p>
 * All rules run, in a fixed order, and every violation is collected. User kernels pass
 * through unchecked.
 */
public class BuiltInShapeChecker {

    private final List<IContractRule> rules;

    /**
     * Creates a checker that accepts several reductions in one built-in.
     */
    public BuiltInShapeChecker() {
        this(false);
    }

    /**
     * Creates a checker.
     * @param rejectMultipleReductions Whether a second reduction in a built-in is a defect.
     */
    public BuiltInShapeChecker(boolean rejectMultipleReductions) {
        this.rules = List.of(
                new SingleWriterRule(),
                new NoOperatorRule(),
                new ReductionIsolationRule(rejectMultipleReductions),
                new SharedSpaceRule(),
                new EffectiveOutputRule(),
                new SharedDataTypeRule(),
                new BuiltInDomainRule());
    }

    /**
     * Validates the shape of a built-in contract.
     * @param contract The contract.
     * @return All violations, grouped by rule in rule order; empty for clean built-ins and for user kernels.
     */
    public List<Diagnostic> validateBuiltIn(KernelContract contract) {
        if (!contract.builtIn()) {
            return List.of();
        }
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        for (IContractRule rule : rules) {
            rule.check(contract, diagnostics);
        }
        return diagnostics.getDiagnostics();
    }
}
