package org.stackvm.runtime.isa;

/**
 * Defines how the operand of an instruction is laid out in the bytecode stream.
 */
public enum OperandEncoding {
    /** No operand follows the opcode byte. */
    NONE(0),
    /** A single unsigned byte (e.g., a local variable index). */
    BYTE(1),
    /** A 32-bit little-endian integer (immediate value, address or global index). */
    INT32(4),
    /** Raw bytes terminated by a zero byte. */
    STRING(-1);

    private final int size;

    OperandEncoding(int size) {
        this.size = size;
    }

    /**
     * Returns the fixed operand size in bytes, or -1 for the variable-length string encoding.
     * @return The operand size.
     */
    public int size() {
        return size;
    }

    /**
     * @return true if the operand length depends on its content.
     */
    public boolean isVariableLength() {
        return size < 0;
    }
}
