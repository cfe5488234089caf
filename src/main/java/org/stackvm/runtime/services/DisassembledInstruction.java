package org.stackvm.runtime.services;

import org.stackvm.runtime.isa.Opcode;

/**
 * One decoded entry of a disassembly.
 *
 * @param address       the byte address of the opcode
 * @param rawOpcode     the opcode byte as found in the code (0..255)
 * @param opcode        the decoded opcode, or null if the byte is not a valid opcode
 * @param operand       the numeric operand, or null if the instruction has none
 * @param stringOperand the string operand, or null if the instruction has none
 * @param length        the number of bytes this entry covers
 * @param truncated     true if the operand was cut off by the end of the code
 */
public record DisassembledInstruction(
        int address,
        int rawOpcode,
        Opcode opcode,
        Integer operand,
        String stringOperand,
        int length,
        boolean truncated
) {

    /** The mnemonic shown for bytes that are not valid opcodes. */
    public static final String INVALID_MNEMONIC = "???";

    public boolean isValid() {
        return opcode != null;
    }

    public String mnemonic() {
        return opcode != null ? opcode.mnemonic() : INVALID_MNEMONIC;
    }

    /**
     * @return The operand column of a listing, e.g. {@code 42}, {@code "Hi\n"} or
     *         {@code (invalid: 0xFF)}; empty for instructions without operand.
     */
    public String operandText() {
        if (opcode == null) {
            return String.format("(invalid: 0x%02X)", rawOpcode);
        }
        if (stringOperand != null) {
            return "\"" + stringOperand + "\"";
        }
        if (operand != null) {
            return operand.toString();
        }
        return truncated ? "(truncated)" : "";
    }
}
