package org.kernform.validator.internal.i18n;

import org.kernform.validator.api.ContractErrorCode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class MessagesTest {

    @Test
    void formatsTheTemplateOfACode() {
        assertThat(Messages.forCode(ContractErrorCode.UNKNOWN_KERNEL, "invoke_0#0:foo", "-1", null, "foo", ""))
                .isEqualTo("Call 'invoke_0#0:foo' refers to unknown kernel 'foo'.");
    }

    @ParameterizedTest
    @EnumSource(ContractErrorCode.class)
    void everyCodeHasATemplate(ContractErrorCode code) {
        assertThat(Messages.forCode(code, "subject", "0", "x", "y", "a, b")).doesNotStartWith("!");
    }
}
