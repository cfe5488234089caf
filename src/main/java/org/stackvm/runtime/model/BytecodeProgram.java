package org.stackvm.runtime.model;

import org.stackvm.runtime.isa.Bytecode;

import java.util.Arrays;
import java.util.Objects;

/**
 * An immutable bytecode program.
 * The bytes are copied on construction and on every export, so a program
 * can never be mutated while a virtual machine executes it.
 */
public final class BytecodeProgram {

    private final byte[] code;

    private BytecodeProgram(byte[] code) {
        this.code = code;
    }

    /**
     * Creates a program from a copy of the given bytes.
     * @param code The raw bytecode.
     * @return The program.
     */
    public static BytecodeProgram of(byte[] code) {
        Objects.requireNonNull(code, "code");
        return new BytecodeProgram(Arrays.copyOf(code, code.length));
    }

    /**
     * @return The number of bytes in the program.
     */
    public int length() {
        return code.length;
    }

    /**
     * Returns the unsigned byte at the given address.
     * @param address The address, which must be in {@code [0, length())}.
     * @return The byte value in 0..255.
     */
    public int byteAt(int address) {
        return code[address] & 0xFF;
    }

    /**
     * @return A copy of the program bytes.
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(code, code.length);
    }

    /**
     * Reads a little-endian 32-bit operand.
     * @param address The address of the first operand byte; four bytes must be available.
     * @return The signed value.
     */
    public int readInt32(int address) {
        return Bytecode.readInt32(code, address);
    }

    /**
     * @param address The address to check.
     * @param count   The number of bytes needed.
     * @return true if {@code count} bytes starting at {@code address} lie inside the program.
     */
    public boolean hasBytes(int address, int count) {
        return address >= 0 && count >= 0 && address <= code.length - count;
    }

    /**
     * Finds the null terminator of a string operand.
     * @param address The first payload byte.
     * @return The terminator address, or {@link #length()} if the string runs to the end of the program.
     */
    public int findTerminator(int address) {
        return Bytecode.findTerminator(code, address, code.length);
    }

    /**
     * Copies a range of bytes.
     * @param from The first address, inclusive.
     * @param to   The last address, exclusive.
     * @return The bytes.
     */
    public byte[] slice(int from, int to) {
        return Arrays.copyOfRange(code, from, to);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BytecodeProgram other)) return false;
        return Arrays.equals(code, other.code);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(code);
    }

    @Override
    public String toString() {
        return "BytecodeProgram[" + code.length + " bytes]";
    }
}
