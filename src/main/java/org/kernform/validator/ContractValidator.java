package org.kernform.validator;

import org.kernform.validator.api.BoundCall;
import org.kernform.validator.api.ContractErrorCode;
import org.kernform.validator.api.IContractValidator;
import org.kernform.validator.api.ValidationException;
import org.kernform.validator.api.ValidationReport;
import org.kernform.validator.binding.BindingResult;
import org.kernform.validator.binding.InvokeCallBinder;
import org.kernform.validator.config.ValidatorOptions;
import org.kernform.validator.diagnostics.Diagnostic;
import org.kernform.validator.diagnostics.DiagnosticsEngine;
import org.kernform.validator.model.CompilationUnit;
import org.kernform.validator.model.Invoke;
import org.kernform.validator.model.KernelCall;
import org.kernform.validator.model.KernelContract;
import org.kernform.validator.registry.BuiltInCatalog;
import org.kernform.validator.registry.ContractRegistry;
import org.kernform.validator.rules.AccessModeRules;
import org.kernform.validator.rules.BuiltInShapeChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The main validator implementation. It orchestrates the validation of one compilation unit:
 * registry construction, contract validation and invocation binding.
 * <p>
 * The validator holds no per-unit state and is thread-safe. With a parallelism above one,
 * contracts and invocations are checked on a worker pool; results are identical to a
 * sequential run.
 */
public class ContractValidator implements IContractValidator {

    private static final Logger LOG = LoggerFactory.getLogger(ContractValidator.class);

    private final ValidatorOptions options;
    private final AccessModeRules accessModeRules = new AccessModeRules();
    private final BuiltInShapeChecker shapeChecker;
    private final InvokeCallBinder binder = new InvokeCallBinder();

    /**
     * Creates a validator with the default options from {@code reference.conf}.
     */
    public ContractValidator() {
        this(ValidatorOptions.defaults());
    }

    /**
     * Creates a validator.
     * @param options The validator options.
     */
    public ContractValidator(ValidatorOptions options) {
        this.options = options;
        this.shapeChecker = new BuiltInShapeChecker(options.rejectMultipleReductions());
    }

    @Override
    public List<Diagnostic> validateContract(KernelContract contract) {
        List<Diagnostic> diagnostics = new ArrayList<>(accessModeRules.validateContract(contract));
        diagnostics.addAll(shapeChecker.validateBuiltIn(contract));
        return Collections.unmodifiableList(diagnostics);
    }

    @Override
    public ValidationReport validate(CompilationUnit unit) throws ValidationException {
        DiagnosticsEngine registryDiagnostics = new DiagnosticsEngine();
        ContractRegistry registry = buildRegistry(unit, registryDiagnostics);

        // Phase 1: contracts, independent of any call site
        List<Callable<List<Diagnostic>>> contractTasks = new ArrayList<>();
        for (KernelContract contract : registry.contracts()) {
            contractTasks.add(() -> validateContract(contract));
        }
        List<List<Diagnostic>> contractResults = runAll(contractTasks);

        List<Diagnostic> diagnostics = new ArrayList<>(registryDiagnostics.getDiagnostics());
        Set<KernelContract> rejected = new HashSet<>();
        Set<String> rejectedSignatures = new LinkedHashSet<>();
        for (int i = 0; i < contractResults.size(); i++) {
            List<Diagnostic> result = contractResults.get(i);
            diagnostics.addAll(result);
            if (!result.isEmpty()) {
                KernelContract contract = registry.contracts().get(i);
                rejected.add(contract);
                rejectedSignatures.add(contract.signature());
                LOG.debug("Contract {} has {} defect(s)", contract.signature(), result.size());
            }
        }

        // Phase 2: call sites; the registry and the rejected set are read-only from here on
        List<Callable<CallOutcome>> callTasks = new ArrayList<>();
        for (Invoke invoke : unit.invokes()) {
            for (int i = 0; i < invoke.calls().size(); i++) {
                final int callIndex = i;
                callTasks.add(() -> bindCall(invoke, callIndex, registry, rejected));
            }
        }
        List<BoundCall> boundCalls = new ArrayList<>();
        for (CallOutcome outcome : runAll(callTasks)) {
            diagnostics.addAll(outcome.diagnostics());
            if (outcome.boundCall() != null) {
                boundCalls.add(outcome.boundCall());
            }
        }

        ValidationReport report = new ValidationReport(unit.name(), diagnostics, boundCalls, rejectedSignatures);
        LOG.info("Validated unit '{}': {} contract(s), {} call(s) bound, {} error(s), {} warning(s)",
                unit.name(), registry.size(), boundCalls.size(), report.errorCount(), report.warningCount());
        return report;
    }

    private ContractRegistry buildRegistry(CompilationUnit unit, DiagnosticsEngine diagnostics) {
        ContractRegistry.Builder builder = ContractRegistry.builder();
        for (KernelContract contract : unit.contracts()) {
            if (!builder.register(contract)) {
                diagnostics.reportWarning(ContractErrorCode.DUPLICATE_CONTRACT, contract.name(),
                        Diagnostic.NO_ARGUMENT, null, contract.signature());
            }
        }
        if (options.includeStandardBuiltIns()) {
            // the unit may shadow a standard built-in with its own declaration
            for (KernelContract builtIn : BuiltInCatalog.standard()) {
                if (!builder.contains(builtIn.name())) {
                    builder.register(builtIn);
                }
            }
        }
        return builder.build();
    }

    private CallOutcome bindCall(Invoke invoke, int callIndex, ContractRegistry registry, Set<KernelContract> rejected) {
        KernelCall call = invoke.calls().get(callIndex);
        String subject = invoke.name() + "#" + callIndex + ":" + call.kernelName();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<KernelContract> candidates = registry.lookup(call.kernelName());
        if (candidates.isEmpty()) {
            diagnostics.reportError(ContractErrorCode.UNKNOWN_KERNEL, subject, Diagnostic.NO_ARGUMENT,
                    null, call.kernelName());
            return new CallOutcome(diagnostics.getDiagnostics(), null);
        }

        BindingResult result = binder.bind(subject, call.arguments(), candidates);
        if (result instanceof BindingResult.Rejected rejectedBinding) {
            diagnostics.addAll(rejectedBinding.diagnostics());
            return new CallOutcome(diagnostics.getDiagnostics(), null);
        }

        BindingResult.Bound bound = (BindingResult.Bound) result;
        if (rejected.contains(bound.contract())) {
            diagnostics.reportError(ContractErrorCode.INVALID_CONTRACT_REFERENCE, subject, Diagnostic.NO_ARGUMENT,
                    null, bound.contract().name());
            return new CallOutcome(diagnostics.getDiagnostics(), null);
        }
        return new CallOutcome(List.of(), new BoundCall(invoke.name(), callIndex, bound));
    }

    private <T> List<T> runAll(List<Callable<T>> tasks) throws ValidationException {
        List<T> results = new ArrayList<>(tasks.size());
        if (options.parallelism() <= 1 || tasks.size() <= 1) {
            for (Callable<T> task : tasks) {
                try {
                    results.add(task.call());
                } catch (Exception e) {
                    throw new ValidationException("Validation task failed: " + e.getMessage(), e);
                }
            }
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(options.parallelism(), tasks.size()), new WorkerThreadFactory());
        try {
            for (Future<T> future : executor.invokeAll(tasks)) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ValidationException("Validation was interrupted", e);
        } catch (ExecutionException e) {
            throw new ValidationException("Validation task failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private record CallOutcome(List<Diagnostic> diagnostics, BoundCall boundCall) {}

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "kernform-validator-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
