package org.stackvm.runtime.isa;

import org.stackvm.runtime.Config;
import org.stackvm.runtime.model.BytecodeProgram;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Appends instructions to a growing, capacity-bounded bytecode buffer.
 * <p>
 * Used by the assembler's second pass and for building programs by hand:
 * <pre>
 * BytecodeProgram program = new BytecodeWriter()
 *         .emit(Opcode.PUSH, 10)
 *         .emit(Opcode.PUSH, 20)
 *         .emit(Opcode.ADD)
 *         .emit(Opcode.HALT)
 *         .toProgram();
 * </pre>
 * Writing past the capacity throws {@link IllegalStateException}.
 */
public class BytecodeWriter {

    private final int capacity;
    private byte[] buffer;
    private int size;

    /**
     * Creates a writer with the default code capacity.
     */
    public BytecodeWriter() {
        this(Config.CODE_CAPACITY);
    }

    /**
     * Creates a writer with the given capacity.
     * @param capacity The maximum number of bytes this writer accepts.
     */
    public BytecodeWriter(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Code capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new byte[Math.min(capacity, 256)];
    }

    /**
     * Emits an instruction without operand.
     * @param opcode The opcode, which must take no operand.
     * @return this writer.
     */
    public BytecodeWriter emit(Opcode opcode) {
        requireEncoding(opcode, OperandEncoding.NONE);
        writeByte(opcode.code());
        return this;
    }

    /**
     * Emits an instruction with a numeric operand (BYTE or INT32 encoding).
     * For BYTE operands only the low 8 bits are written.
     *
     * @param opcode  The opcode.
     * @param operand The operand value.
     * @return this writer.
     */
    public BytecodeWriter emit(Opcode opcode, int operand) {
        switch (opcode.encoding()) {
            case BYTE -> {
                ensureRoom(2);
                writeByte(opcode.code());
                writeByte((byte) operand);
            }
            case INT32 -> {
                ensureRoom(5);
                writeByte(opcode.code());
                writeInt32(operand);
            }
            default -> throw new IllegalArgumentException(opcode.mnemonic() + " does not take a numeric operand");
        }
        return this;
    }

    /**
     * Emits an instruction with a string operand followed by its null terminator.
     *
     * @param opcode The opcode, which must use the STRING encoding.
     * @param text   The payload; its UTF-8 encoding must not contain a zero byte.
     * @return this writer.
     */
    public BytecodeWriter emit(Opcode opcode, String text) {
        return emit(opcode, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Emits an instruction with a raw string payload followed by its null terminator.
     *
     * @param opcode  The opcode, which must use the STRING encoding.
     * @param payload The payload bytes; must not contain a zero byte.
     * @return this writer.
     */
    public BytecodeWriter emit(Opcode opcode, byte[] payload) {
        requireEncoding(opcode, OperandEncoding.STRING);
        for (byte b : payload) {
            if (b == 0) {
                throw new IllegalArgumentException("String operand must not contain a zero byte");
            }
        }
        ensureRoom(payload.length + 2);
        writeByte(opcode.code());
        for (byte b : payload) {
            writeByte(b);
        }
        writeByte((byte) 0);
        return this;
    }

    /**
     * Appends a single raw byte. Useful for crafting invalid programs in tests.
     * @param value The byte to append (low 8 bits).
     * @return this writer.
     */
    public BytecodeWriter raw(int value) {
        ensureRoom(1);
        writeByte((byte) value);
        return this;
    }

    /**
     * @return The number of bytes written so far, which is also the address of the next instruction.
     */
    public int size() {
        return size;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * @return A copy of the bytes written so far.
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(buffer, size);
    }

    /**
     * @return An immutable program holding the bytes written so far.
     */
    public BytecodeProgram toProgram() {
        return BytecodeProgram.of(toByteArray());
    }

    private void requireEncoding(Opcode opcode, OperandEncoding expected) {
        if (opcode.encoding() != expected) {
            throw new IllegalArgumentException(opcode.mnemonic() + " expects a " + opcode.encoding() + " operand");
        }
    }

    private void ensureRoom(int count) {
        if (size + count > capacity) {
            throw new IllegalStateException("Code buffer overflow: " + (size + count) + " bytes exceed capacity " + capacity);
        }
        if (size + count > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.min(capacity, Math.max(buffer.length * 2, size + count)));
        }
    }

    private void writeByte(byte value) {
        ensureRoom(1);
        buffer[size++] = value;
    }

    private void writeInt32(int value) {
        ensureRoom(4);
        Bytecode.writeInt32(buffer, size, value);
        size += 4;
    }
}
