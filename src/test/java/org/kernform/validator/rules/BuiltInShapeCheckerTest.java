package org.kernform.validator.rules;

import org.kernform.validator.api.ContractErrorCode;
import org.kernform.validator.diagnostics.Diagnostic;
import org.kernform.validator.model.ArgumentDescriptor;
import org.kernform.validator.model.ArgumentKind;
import org.kernform.validator.model.BuiltInTag;
import org.kernform.validator.model.IterationDomain;
import org.kernform.validator.model.KernelContract;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.kernform.validator.model.AccessMode.INC;
import static org.kernform.validator.model.AccessMode.READ;
import static org.kernform.validator.model.AccessMode.READWRITE;
import static org.kernform.validator.model.AccessMode.SUM;
import static org.kernform.validator.model.AccessMode.WRITE;
import static org.kernform.validator.model.DataType.INTEGER;
import static org.kernform.validator.model.DataType.REAL;

/**
 * Contains unit tests for the {@link BuiltInShapeChecker}.
 * The broken built-ins mirror the shapes a library author is most likely to get wrong.
 */
@Tag("unit")
class BuiltInShapeCheckerTest {

    private final BuiltInShapeChecker checker = new BuiltInShapeChecker();

    @Test
    void twoWrittenFieldsAreOneInvalidWriteCount() {
        KernelContract contract = KernelContract.builtIn("X_plus_Y")
                .field(REAL, WRITE, "any_space_1")
                .field(REAL, WRITE, "any_space_1")
                .build();

        assertThat(checker.validateBuiltIn(contract))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.code()).isEqualTo(ContractErrorCode.INVALID_WRITE_COUNT);
                    assertThat(d.expected()).isEqualTo("1");
                    assertThat(d.actual()).isEqualTo("2");
                    assertThat(d.hasArgumentIndex()).isFalse();
                });
    }

    @Test
    void reductionWithoutWrittenFieldIsFlaggedAsMissingWriter() {
        KernelContract contract = KernelContract.builtIn("sum_X")
                .scalar(REAL, SUM)
                .field(REAL, READ, "any_space_1")
                .build();

        assertThat(checker.validateBuiltIn(contract))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.code()).isEqualTo(ContractErrorCode.INVALID_WRITE_COUNT);
                    assertThat(d.expected()).isEqualTo("1");
                    assertThat(d.actual()).isEqualTo("0");
                });
    }

    @Test
    void writeReadWriteWithScalarReportsOnlyTheWriteCount() {
        KernelContract contract = KernelContract.builtIn("aX_plus_Y")
                .field(REAL, WRITE, "any_space_1")
                .scalar(REAL, READ)
                .field(REAL, READ, "any_space_1")
                .field(REAL, WRITE, "any_space_1")
                .build();

        List<Diagnostic> diagnostics = checker.validateBuiltIn(contract);

        assertThat(diagnostics).extracting(Diagnostic::code).containsExactly(ContractErrorCode.INVALID_WRITE_COUNT);
        assertThat(diagnostics.get(0).expected()).isEqualTo("1");
        assertThat(diagnostics.get(0).actual()).isEqualTo("2");
    }

    @Test
    void twoReductionsAlongsideOneReadWriteFieldAreAccepted() {
        KernelContract contract = KernelContract.builtIn("inc_X_with_sums")
                .scalar(REAL, SUM)
                .field(REAL, READWRITE, "any_space_1")
                .scalar(REAL, SUM)
                .build();

        assertThat(checker.validateBuiltIn(contract)).isEmpty();
    }

    @Test
    void twoReductionsAreRejectedWhenConfigured() {
        KernelContract contract = KernelContract.builtIn("inc_X_with_sums")
                .scalar(REAL, SUM)
                .field(REAL, READWRITE, "any_space_1")
                .scalar(REAL, SUM)
                .build();

        assertThat(new BuiltInShapeChecker(true).validateBuiltIn(contract))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.code()).isEqualTo(ContractErrorCode.MULTIPLE_REDUCTIONS);
                    assertThat(d.argumentIndex()).isEqualTo(2);
                });
    }

    @Test
    void operatorArgumentIsRejectedRegardlessOfTheRest() {
        KernelContract contract = KernelContract.builtIn("a_times_X")
                .field(REAL, WRITE, "any_space_1")
                .scalar(REAL, READ)
                .operator(REAL, READ, "any_space_1", "any_space_1")
                .build();

        assertThat(checker.validateBuiltIn(contract))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.code()).isEqualTo(ContractErrorCode.OPERATOR_ARGUMENT_IN_BUILT_IN);
                    assertThat(d.argumentIndex()).isEqualTo(2);
                });
    }

    @Test
    void fusedReductionWithOneReadWriteFieldIsValid() {
        KernelContract contract = KernelContract.builtIn("inc_aX_plus_Y_sum")
                .scalar(REAL, SUM)
                .field(REAL, READWRITE, "any_space_1")
                .field(REAL, READ, "any_space_1")
                .build();

        assertThat(checker.validateBuiltIn(contract)).isEmpty();
    }

    @Test
    void reductionMixedWithReadWriteAndWriteFieldsConflicts() {
        KernelContract contract = KernelContract.builtIn("inc_aX_plus_bY")
                .scalar(REAL, SUM)
                .field(REAL, READWRITE, "any_space_1")
                .scalar(REAL, READ)
                .field(REAL, WRITE, "any_space_1")
                .build();

        List<Diagnostic> diagnostics = checker.validateBuiltIn(contract);

        // rule 1 (two writers) comes before rule 3
        assertThat(diagnostics).extracting(Diagnostic::code).containsExactly(
                ContractErrorCode.INVALID_WRITE_COUNT,
                ContractErrorCode.CONFLICTING_REDUCTION_AND_WRITE);
        Diagnostic conflict = diagnostics.get(1);
        assertThat(conflict.argumentIndex()).isEqualTo(3);
        assertThat(conflict.expected()).isEqualTo("READWRITE");
        assertThat(conflict.actual()).isEqualTo("WRITE");
    }

    @Test
    void differentlyPermissionedWritersWithoutReductionAreOnlyAWriteCountDefect() {
        KernelContract contract = KernelContract.builtIn("inc_aX_plus_bY")
                .scalar(REAL, READ)
                .field(REAL, READWRITE, "any_space_1")
                .scalar(REAL, READ)
                .field(REAL, WRITE, "any_space_1")
                .build();

        assertThat(checker.validateBuiltIn(contract)).extracting(Diagnostic::code)
                .containsExactly(ContractErrorCode.INVALID_WRITE_COUNT);
    }

    @Test
    void reductionOnAFieldIsRejected() {
        KernelContract contract = KernelContract.builtIn("bad_sum")
                .field(REAL, SUM, "any_space_1")
                .field(REAL, WRITE, "any_space_1")
                .build();

        assertThat(checker.validateBuiltIn(contract))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.code()).isEqualTo(ContractErrorCode.REDUCTION_ON_NON_SCALAR);
                    assertThat(d.argumentIndex()).isEqualTo(0);
                    assertThat(d.actual()).isEqualTo("FIELD");
                });
    }

    @Test
    void fieldsOnDifferentSpacesAreReported() {
        KernelContract contract = KernelContract.builtIn("inc_X_divideby_Y")
                .field(REAL, READWRITE, "any_space_1")
                .field(REAL, READ, "any_space_2")
                .build();

        assertThat(checker.validateBuiltIn(contract))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.code()).isEqualTo(ContractErrorCode.SPACE_MISMATCH);
                    assertThat(d.argumentIndex()).isEqualTo(1);
                    assertThat(d.expected()).isEqualTo("any_space_1");
                    assertThat(d.actual()).isEqualTo("any_space_2");
                });
    }

    @Test
    void spaceNamesCompareCaseInsensitively() {
        KernelContract contract = KernelContract.builtIn("inc_X_plus_Y")
                .field(REAL, READWRITE, "ANY_SPACE_1")
                .field(REAL, READ, "any_space_1")
                .build();

        assertThat(checker.validateBuiltIn(contract)).isEmpty();
    }

    @Test
    void fieldsWithoutASpaceAreLeftToTheSpaceCountCheck() {
        KernelContract contract = KernelContract.builtIn("X_plus_Y")
                .arg(new ArgumentDescriptor(ArgumentKind.FIELD, REAL, WRITE, List.of()))
                .field(REAL, READ, "any_space_1")
                .field(REAL, READ, "any_space_2")
                .build();

        assertThat(checker.validateBuiltIn(contract))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.code()).isEqualTo(ContractErrorCode.SPACE_MISMATCH);
                    assertThat(d.argumentIndex()).isEqualTo(2);
                    assertThat(d.expected()).isEqualTo("any_space_1");
                    assertThat(d.message()).doesNotContain("null");
                });
    }

    @Test
    void conversionsMayMixSpacesAndDataTypes() {
        KernelContract contract = KernelContract.builtIn("int_X")
                .tag(BuiltInTag.CROSS_SPACE_CONVERSION)
                .field(INTEGER, WRITE, "any_space_1")
                .field(REAL, READ, "any_space_2")
                .build();

        assertThat(checker.validateBuiltIn(contract)).isEmpty();
    }

    @Test
    void mixedFieldDataTypesNeedTheConversionTag() {
        KernelContract contract = KernelContract.builtIn("int_X")
                .field(INTEGER, WRITE, "any_space_1")
                .field(REAL, READ, "any_space_1")
                .build();

        assertThat(checker.validateBuiltIn(contract))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.code()).isEqualTo(ContractErrorCode.DATA_TYPE_MISMATCH);
                    assertThat(d.argumentIndex()).isEqualTo(1);
                    assertThat(d.expected()).isEqualTo("INTEGER");
                    assertThat(d.actual()).isEqualTo("REAL");
                });
    }

    @Test
    void scalarsOnlyWithoutReductionHaveNoOutput() {
        KernelContract contract = KernelContract.builtIn("setval_X")
                .scalar(REAL, READ)
                .scalar(REAL, READ)
                .build();

        assertThat(checker.validateBuiltIn(contract)).extracting(Diagnostic::code)
                .containsExactly(ContractErrorCode.NO_EFFECTIVE_OUTPUT);
    }

    @Test
    void scalarReductionWithoutFieldsIsAnOutput() {
        KernelContract contract = KernelContract.builtIn("setval_X")
                .scalar(REAL, SUM)
                .scalar(REAL, READ)
                .build();

        assertThat(checker.validateBuiltIn(contract)).isEmpty();
    }

    @Test
    void pureReductionMustNotWriteAndMustReduce() {
        KernelContract writes = KernelContract.builtIn("X_innerproduct_Y")
                .tag(BuiltInTag.PURE_REDUCTION)
                .scalar(REAL, SUM)
                .field(REAL, INC, "any_space_1")
                .build();
        KernelContract noSum = KernelContract.builtIn("X_innerproduct_Y")
                .tag(BuiltInTag.PURE_REDUCTION)
                .scalar(REAL, READ)
                .field(REAL, READ, "any_space_1")
                .build();

        assertThat(checker.validateBuiltIn(writes))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.code()).isEqualTo(ContractErrorCode.INVALID_WRITE_COUNT);
                    assertThat(d.expected()).isEqualTo("0");
                    assertThat(d.actual()).isEqualTo("1");
                });
        assertThat(checker.validateBuiltIn(noSum)).extracting(Diagnostic::code)
                .containsExactly(ContractErrorCode.NO_EFFECTIVE_OUTPUT);
    }

    @Test
    void builtInsMustIterateOverDofs() {
        KernelContract contract = KernelContract.builtIn("setval_c")
                .operatesOn(IterationDomain.CELL_COLUMN)
                .field(REAL, WRITE, "any_space_1")
                .scalar(REAL, READ)
                .build();

        assertThat(checker.validateBuiltIn(contract))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.code()).isEqualTo(ContractErrorCode.INVALID_BUILT_IN_DOMAIN);
                    assertThat(d.expected()).isEqualTo("DOF");
                    assertThat(d.actual()).isEqualTo("CELL_COLUMN");
                });
    }

    @Test
    void allViolationsAreReportedInRuleOrder() {
        KernelContract contract = KernelContract.builtIn("everything_wrong")
                .operatesOn(IterationDomain.DOMAIN)
                .field(REAL, WRITE, "any_space_1")
                .operator(REAL, READ, "any_space_1", "any_space_2")
                .field(INTEGER, WRITE, "any_space_2")
                .field(REAL, READ, "any_space_3")
                .build();

        List<Diagnostic> diagnostics = checker.validateBuiltIn(contract);

        assertThat(diagnostics).extracting(Diagnostic::code).containsExactly(
                ContractErrorCode.INVALID_WRITE_COUNT,
                ContractErrorCode.OPERATOR_ARGUMENT_IN_BUILT_IN,
                ContractErrorCode.SPACE_MISMATCH,
                ContractErrorCode.SPACE_MISMATCH,
                ContractErrorCode.DATA_TYPE_MISMATCH,
                ContractErrorCode.INVALID_BUILT_IN_DOMAIN);
        assertThat(diagnostics.get(2).argumentIndex()).isEqualTo(2);
        assertThat(diagnostics.get(3).argumentIndex()).isEqualTo(3);
    }

    @Test
    void userKernelsAreNotHeldToBuiltInRules() {
        KernelContract contract = KernelContract.kernel("testkern_code")
                .field(REAL, INC, "w1")
                .field(REAL, INC, "w2")
                .operator(REAL, READ, "w1", "w2")
                .build();

        assertThat(checker.validateBuiltIn(contract)).isEmpty();
    }

    @Test
    void repeatedValidationGivesIdenticalResults() {
        KernelContract contract = KernelContract.builtIn("aX_plus_Y")
                .field(REAL, WRITE, "any_space_1")
                .operator(REAL, READ, "any_space_1", "any_space_1")
                .field(REAL, WRITE, "any_space_2")
                .build();

        List<Diagnostic> first = checker.validateBuiltIn(contract);
        List<Diagnostic> second = checker.validateBuiltIn(contract);

        assertThat(first).isNotEmpty().isEqualTo(second);
    }
}
