package org.stackvm.runtime.isa;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed opcode table of the virtual machine.
 * <p>
 * The byte value of an opcode is its declaration order, so the order of the constants
 * below is part of the bytecode format and must not change.
 */
public enum Opcode {
    // Stack manipulation
    NOP("NOP", OperandEncoding.NONE),
    PUSH("PUSH", OperandEncoding.INT32),
    POP("POP", OperandEncoding.NONE),
    DUP("DUP", OperandEncoding.NONE),
    SWAP("SWAP", OperandEncoding.NONE),
    OVER("OVER", OperandEncoding.NONE),

    // Arithmetic
    ADD("ADD", OperandEncoding.NONE),
    SUB("SUB", OperandEncoding.NONE),
    MUL("MUL", OperandEncoding.NONE),
    DIV("DIV", OperandEncoding.NONE),
    MOD("MOD", OperandEncoding.NONE),
    NEG("NEG", OperandEncoding.NONE),
    INC("INC", OperandEncoding.NONE),
    DEC("DEC", OperandEncoding.NONE),

    // Comparison
    EQ("EQ", OperandEncoding.NONE),
    NE("NE", OperandEncoding.NONE),
    LT("LT", OperandEncoding.NONE),
    LE("LE", OperandEncoding.NONE),
    GT("GT", OperandEncoding.NONE),
    GE("GE", OperandEncoding.NONE),

    // Logical and bitwise
    AND("AND", OperandEncoding.NONE),
    OR("OR", OperandEncoding.NONE),
    NOT("NOT", OperandEncoding.NONE),
    BAND("BAND", OperandEncoding.NONE),
    BOR("BOR", OperandEncoding.NONE),
    BNOT("BNOT", OperandEncoding.NONE),
    XOR("XOR", OperandEncoding.NONE),
    SHL("SHL", OperandEncoding.NONE),
    SHR("SHR", OperandEncoding.NONE),

    // Control flow
    JMP("JMP", OperandEncoding.INT32),
    JZ("JZ", OperandEncoding.INT32),
    JNZ("JNZ", OperandEncoding.INT32),
    CALL("CALL", OperandEncoding.INT32),
    RET("RET", OperandEncoding.NONE),

    // Variable access
    LOAD_LOCAL("LOAD_LOCAL", OperandEncoding.BYTE),
    STORE_LOCAL("STORE_LOCAL", OperandEncoding.BYTE),
    LOAD_GLOBAL("LOAD_GLOBAL", OperandEncoding.INT32),
    STORE_GLOBAL("STORE_GLOBAL", OperandEncoding.INT32),

    // I/O
    PRINT("PRINT", OperandEncoding.NONE),
    PRINT_CHAR("PRINT_CHAR", OperandEncoding.NONE),
    PRINT_STR("PRINT_STR", OperandEncoding.STRING),
    READ("READ", OperandEncoding.NONE),

    // Special
    HALT("HALT", OperandEncoding.NONE),
    DEBUG("DEBUG", OperandEncoding.NONE);

    private static final Opcode[] BY_CODE = values();
    private static final Map<String, Opcode> BY_MNEMONIC;

    static {
        Map<String, Opcode> map = new HashMap<>();
        for (Opcode opcode : BY_CODE) {
            map.put(opcode.mnemonic, opcode);
        }
        BY_MNEMONIC = Collections.unmodifiableMap(map);
    }

    private final String mnemonic;
    private final OperandEncoding encoding;

    Opcode(String mnemonic, OperandEncoding encoding) {
        this.mnemonic = mnemonic;
        this.encoding = encoding;
    }

    /**
     * Looks up an opcode by its byte value.
     * @param code The opcode byte, interpreted as unsigned (0..255).
     * @return The opcode, or empty if the byte is outside the opcode range.
     */
    public static Optional<Opcode> fromByte(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            return Optional.empty();
        }
        return Optional.of(BY_CODE[code]);
    }

    /**
     * Looks up an opcode by its mnemonic, ignoring case.
     * @param mnemonic The mnemonic, e.g. "push" or "PUSH".
     * @return The opcode, or empty if there is no such mnemonic.
     */
    public static Optional<Opcode> byMnemonic(String mnemonic) {
        if (mnemonic == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_MNEMONIC.get(mnemonic.toUpperCase(Locale.ROOT)));
    }

    /**
     * @return The number of defined opcodes.
     */
    public static int count() {
        return BY_CODE.length;
    }

    public String mnemonic() {
        return mnemonic;
    }

    public OperandEncoding encoding() {
        return encoding;
    }

    /**
     * @return The byte value of this opcode in the bytecode stream.
     */
    public byte code() {
        return (byte) ordinal();
    }

    /**
     * Returns the encoded length of an instruction with a fixed-size operand.
     * @return 1 + operand size.
     * @throws IllegalStateException for the variable-length string encoding.
     */
    public int fixedLength() {
        if (encoding.isVariableLength()) {
            throw new IllegalStateException(mnemonic + " has a variable-length operand");
        }
        return 1 + encoding.size();
    }

    /**
     * Returns the encoded length of an instruction.
     * @param payloadLength The string payload size in bytes, ignored for fixed-size encodings.
     * @return The number of bytes the instruction occupies.
     */
    public int encodedLength(int payloadLength) {
        return encoding.isVariableLength() ? payloadLength + 2 : fixedLength();
    }
}
