package org.kernform.validator.binding;

import org.kernform.validator.api.ContractErrorCode;
import org.kernform.validator.diagnostics.Diagnostic;
import org.kernform.validator.diagnostics.DiagnosticsEngine;
import org.kernform.validator.model.ArgumentDescriptor;
import org.kernform.validator.model.InvocationArgument;
import org.kernform.validator.model.KernelContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Matches the actual arguments of one invocation against candidate kernel contracts.
 * <p>
 * Candidates are first filtered by arity, then by the kind and data type of every argument.
 * Unresolved kinds or data types on the call side match anything; the check is deferred to
 * code generation. The binder never picks between several matching candidates.
 * <p>
 * Stateless and thread-safe.
 */
public class InvokeCallBinder {

    private static final Logger LOG = LoggerFactory.getLogger(InvokeCallBinder.class);
    private static final String DEFAULT_SUBJECT = "<invocation>";

    /**
     * Binds an invocation.
     * @param invocationArguments The actual arguments, in order.
     * @param candidates The in-scope contracts with the called name.
     * @return The binding result.
     */
    public BindingResult bind(List<InvocationArgument> invocationArguments, Collection<KernelContract> candidates) {
        return bind(DEFAULT_SUBJECT, invocationArguments, candidates);
    }

    /**
     * Binds an invocation.
     * @param subject The label used for the invocation in diagnostics.
     * @param invocationArguments The actual arguments, in order.
     * @param candidates The in-scope contracts with the called name, in lookup order.
     * @return The binding result.
     */
    public BindingResult bind(String subject, List<InvocationArgument> invocationArguments,
                              Collection<KernelContract> candidates) {
        int arity = invocationArguments.size();
        List<KernelContract> sameArity = candidates.stream()
                .filter(c -> c.arity() == arity)
                .toList();

        if (sameArity.isEmpty()) {
            DiagnosticsEngine diagnostics = new DiagnosticsEngine();
            String expected = candidates.stream()
                    .map(c -> String.valueOf(c.arity()))
                    .distinct()
                    .collect(Collectors.joining(" or "));
            diagnostics.reportError(ContractErrorCode.ARITY_MISMATCH, subject, Diagnostic.NO_ARGUMENT,
                    expected.isEmpty() ? null : expected, arity);
            LOG.debug("{}: no candidate takes {} argument(s)", subject, arity);
            return new BindingResult.Rejected(diagnostics.getDiagnostics());
        }

        List<KernelContract> matching = new ArrayList<>();
        List<Diagnostic> mismatches = new ArrayList<>();
        for (KernelContract candidate : sameArity) {
            List<Diagnostic> local = compare(subject, candidate, invocationArguments);
            if (local.isEmpty()) {
                matching.add(candidate);
            } else {
                mismatches.addAll(local);
            }
        }

        if (matching.size() == 1) {
            KernelContract contract = matching.get(0);
            List<BoundArgument> mapping = new ArrayList<>(arity);
            for (int i = 0; i < arity; i++) {
                mapping.add(new BoundArgument(i, contract.arguments().get(i), invocationArguments.get(i)));
            }
            LOG.debug("{}: bound to {}", subject, contract.signature());
            return new BindingResult.Bound(contract, mapping);
        }

        if (matching.isEmpty()) {
            LOG.debug("{}: all {} candidate(s) of matching arity rejected", subject, sameArity.size());
            return new BindingResult.Rejected(deduplicate(mismatches));
        }

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        diagnostics.reportError(ContractErrorCode.AMBIGUOUS_INVOCATION, subject,
                matching.stream().map(KernelContract::name).toList());
        LOG.debug("{}: ambiguous between {} candidates", subject, matching.size());
        return new BindingResult.Rejected(diagnostics.getDiagnostics());
    }

    private List<Diagnostic> compare(String subject, KernelContract candidate, List<InvocationArgument> actuals) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        for (int i = 0; i < actuals.size(); i++) {
            ArgumentDescriptor formal = candidate.arguments().get(i);
            InvocationArgument actual = actuals.get(i);
            boolean kindMatches = !actual.isKindKnown() || actual.kind() == formal.kind();
            boolean typeMatches = !actual.isDataTypeKnown() || actual.dataType() == formal.dataType();
            if (!kindMatches || !typeMatches) {
                diagnostics.reportError(ContractErrorCode.TYPE_MISMATCH, subject, i,
                        formal.kind() + ":" + formal.dataType(), actual.describeType());
            }
        }
        return diagnostics.getDiagnostics();
    }

    /**
     * Keeps the first diagnostic per (code, argument index), ordered by argument index.
     */
    private List<Diagnostic> deduplicate(List<Diagnostic> diagnostics) {
        Set<String> seen = new HashSet<>();
        List<Diagnostic> unique = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            if (seen.add(d.code() + "#" + d.argumentIndex())) {
                unique.add(d);
            }
        }
        unique.sort(Comparator.comparingInt(Diagnostic::argumentIndex));
        return unique;
    }
}
