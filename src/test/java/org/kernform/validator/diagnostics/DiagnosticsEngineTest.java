package org.kernform.validator.diagnostics;

import org.kernform.validator.api.ContractErrorCode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DiagnosticsEngineTest {

    @Test
    void errorsAndWarningsAreCollectedInOrder() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportWarning(ContractErrorCode.DUPLICATE_CONTRACT, "setval_c", Diagnostic.NO_ARGUMENT, null, "setval_c(...)");
        engine.reportError(ContractErrorCode.SPACE_MISMATCH, "inc_X_divideby_Y", 1, "any_space_1", "any_space_2");

        assertThat(engine.getDiagnostics()).extracting(Diagnostic::type)
                .containsExactly(Diagnostic.Type.WARNING, Diagnostic.Type.ERROR);
        Diagnostic mismatch = engine.getDiagnostics().get(1);
        assertThat(mismatch.message())
                .isEqualTo("Argument 1 of built-in 'inc_X_divideby_Y' is on space 'any_space_2' "
                        + "but the fields of this built-in are on 'any_space_1'.");
    }

    @Test
    void candidatesAreRenderedIntoTheMessage() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportError(ContractErrorCode.AMBIGUOUS_INVOCATION, "invoke_0#0:kern", List.of("kern_a", "kern_b"));

        Diagnostic diagnostic = engine.getDiagnostics().get(0);
        assertThat(diagnostic.candidates()).containsExactly("kern_a", "kern_b");
        assertThat(diagnostic.hasArgumentIndex()).isFalse();
        assertThat(diagnostic.message()).endsWith("kern_a, kern_b.");
    }

    @Test
    void summaryHasOneLinePerDiagnostic() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportError(ContractErrorCode.NO_EFFECTIVE_OUTPUT, "setval_X", Diagnostic.NO_ARGUMENT, null, null);
        engine.reportError(ContractErrorCode.ILLEGAL_ACCESS_MODE, "setval_X", 0, "SCALAR", "WRITE");

        assertThat(DiagnosticsEngine.summarize(engine.getDiagnostics()).split("\n")).containsExactly(
                "[ERROR] setval_X: NO_EFFECTIVE_OUTPUT: Built-in 'setval_X' neither writes a field nor performs a reduction.",
                "[ERROR] setval_X[0]: ILLEGAL_ACCESS_MODE: Argument 0 of 'setval_X': kind SCALAR does not allow access WRITE.");
    }

    @Test
    void everyCodeHasAMessageTemplate() {
        for (ContractErrorCode code : ContractErrorCode.values()) {
            DiagnosticsEngine engine = new DiagnosticsEngine();
            engine.reportError(code, "subject", 0, "x", "y");
            assertThat(engine.getDiagnostics().get(0).message()).as(code.name()).doesNotStartWith("!");
        }
    }
}
