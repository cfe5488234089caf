package org.stackvm.assembler;

import java.text.MessageFormat;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Looks up the text of assembly errors in the {@code assembler_messages} bundle.
 */
final class Messages {

    private static final ResourceBundle BUNDLE = ResourceBundle.getBundle("assembler_messages");

    private Messages() {}

    /**
     * Formats the message of an error code.
     * @param code The error code whose message key is looked up.
     * @param args The values for the placeholders of the pattern.
     * @return The formatted message, or {@code !key!} if the bundle has no pattern for the code.
     */
    static String format(AssemblyErrorCode code, Object... args) {
        String pattern;
        try {
            pattern = BUNDLE.getString(code.messageKey());
        } catch (MissingResourceException e) {
            return "!" + code.messageKey() + "!";
        }
        return MessageFormat.format(pattern, args);
    }
}
