package org.stackvm.assembler;

/**
 * Defines unique, testable error codes for everything that can go wrong during assembly.
 * This decouples tests from the wording of the messages.
 */
public enum AssemblyErrorCode {
    /** The mnemonic does not name an instruction. */
    UNKNOWN_MNEMONIC("assembler.unknownMnemonic"),
    /** An instruction that takes an operand has none. */
    MISSING_OPERAND("assembler.missingOperand"),
    /** An operand is malformed or out of range. */
    INVALID_OPERAND("assembler.invalidOperand"),
    /** An instruction that takes no operand has one. */
    UNEXPECTED_OPERAND("assembler.unexpectedOperand"),
    /** A string operand is not enclosed in quotes. */
    UNTERMINATED_STRING("assembler.unterminatedString"),
    /** A label is defined twice. */
    DUPLICATE_LABEL("assembler.duplicateLabel"),
    /** A referenced label is never defined. */
    UNDEFINED_LABEL("assembler.undefinedLabel"),
    /** The source defines more labels than allowed. */
    TOO_MANY_LABELS("assembler.tooManyLabels"),
    /** The program does not fit in the code buffer. */
    CODE_CAPACITY_EXCEEDED("assembler.codeCapacityExceeded"),
    /** The two passes disagree; indicates a bug in the assembler. */
    INTERNAL_ERROR("assembler.internalError");

    private final String messageKey;

    AssemblyErrorCode(String messageKey) {
        this.messageKey = messageKey;
    }

    /**
     * @return The key of the message template in the assembler message bundle.
     */
    public String messageKey() {
        return messageKey;
    }
}
