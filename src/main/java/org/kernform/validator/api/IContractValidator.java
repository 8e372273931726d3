package org.kernform.validator.api;

import org.kernform.validator.diagnostics.Diagnostic;
import org.kernform.validator.diagnostics.DiagnosticsEngine;
import org.kernform.validator.model.CompilationUnit;
import org.kernform.validator.model.KernelContract;

import java.util.List;

/**
 * Defines the public interface of the kernel contract validator.
 */
public interface IContractValidator {

    /**
     * Validates a single contract: the access-mode rules for every contract, plus the
     * shape rules for built-ins.
     *
     * @param contract The contract.
     * @return The diagnostics; empty if the contract is valid.
     */
    List<Diagnostic> validateContract(KernelContract contract);

    /**
     * Validates all contracts of a compilation unit and binds all of its invocations.
     * Defects are reported in the returned report, never thrown.
     *
     * @param unit The compilation unit.
     * @return The report.
     * @throws ValidationException if validation could not be carried out.
     */
    ValidationReport validate(CompilationUnit unit) throws ValidationException;

    /**
     * Validates a compilation unit and fails if it has errors.
     *
     * @param unit The compilation unit.
     * @return The report, which contains no errors.
     * @throws ValidationException if validation failed or reported errors.
     */
    default ValidationReport validateOrThrow(CompilationUnit unit) throws ValidationException {
        ValidationReport report = validate(unit);
        if (report.hasErrors()) {
            throw new ValidationException(DiagnosticsEngine.summarize(report.diagnostics()), report);
        }
        return report;
    }
}
