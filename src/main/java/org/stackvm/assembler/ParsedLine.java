package org.stackvm.assembler;

/**
 * The syntactic parts of one source line.
 *
 * @param source   the line as written
 * @param label    the label defined on this line, or null
 * @param mnemonic the instruction mnemonic as written, or null if the line holds no instruction
 * @param operand  the trimmed operand text, empty if there is none
 */
public record ParsedLine(
        SourceLine source,
        String label,
        String mnemonic,
        String operand
) {

    public boolean hasInstruction() {
        return mnemonic != null;
    }

    public boolean hasOperand() {
        return !operand.isEmpty();
    }
}
