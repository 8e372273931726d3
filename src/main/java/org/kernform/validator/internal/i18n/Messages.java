package org.kernform.validator.internal.i18n;

import org.kernform.validator.api.ContractErrorCode;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Renders diagnostic messages from the {@code contract_messages} bundle.
 * <p>
 * Every {@link ContractErrorCode} has one template under {@code diagnostic.<code in lower case>}.
 * Template arguments are {@code {0}} subject, {@code {1}} argument index, {@code {2}} expected,
 * {@code {3}} actual and {@code {4}} candidate names.
 */
public final class Messages {

    private static final String BUNDLE_BASE_NAME = "contract_messages";
    private static final String KEY_PREFIX = "diagnostic.";
    private static final ResourceBundle BUNDLE = ResourceBundle.getBundle(BUNDLE_BASE_NAME, Locale.getDefault());

    private Messages() {}

    /**
     * Formats the message template of a code.
     * @param code The defect code.
     * @param args The template arguments.
     * @return The message, or {@code !key!} if the bundle has no template for the code.
     */
    public static String forCode(ContractErrorCode code, Object... args) {
        String key = keyOf(code);
        try {
            return MessageFormat.format(BUNDLE.getString(key), args);
        } catch (MissingResourceException e) {
            return "!" + key + "!";
        }
    }

    private static String keyOf(ContractErrorCode code) {
        return KEY_PREFIX + code.name().toLowerCase(Locale.ROOT);
    }
}
