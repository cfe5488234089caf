package org.stackvm.runtime.isa;

/**
 * Static helpers for reading the little-endian bytecode encoding.
 * This final class is not meant to be instantiated.
 */
public final class Bytecode {

    private Bytecode() {}

    /**
     * Reads a signed 32-bit little-endian integer.
     * The caller is responsible for checking that four bytes are available.
     *
     * @param code   The bytecode buffer.
     * @param offset The offset of the least significant byte.
     * @return The decoded value.
     */
    public static int readInt32(byte[] code, int offset) {
        return (code[offset] & 0xFF)
                | (code[offset + 1] & 0xFF) << 8
                | (code[offset + 2] & 0xFF) << 16
                | (code[offset + 3] & 0xFF) << 24;
    }

    /**
     * Reads an unsigned byte.
     * @param code   The bytecode buffer.
     * @param offset The offset to read.
     * @return The value in 0..255.
     */
    public static int readUnsignedByte(byte[] code, int offset) {
        return code[offset] & 0xFF;
    }

    /**
     * Finds the null terminator of a string operand.
     *
     * @param code   The bytecode buffer.
     * @param offset The first payload byte.
     * @param limit  The exclusive end of the readable region.
     * @return The index of the terminator, or {@code limit} if the string is not terminated.
     */
    public static int findTerminator(byte[] code, int offset, int limit) {
        int i = offset;
        while (i < limit && code[i] != 0) {
            i++;
        }
        return i;
    }

    /**
     * Writes a 32-bit integer in little-endian order.
     * @param target The destination buffer.
     * @param offset The offset of the least significant byte.
     * @param value  The value to write.
     */
    public static void writeInt32(byte[] target, int offset, int value) {
        target[offset] = (byte) value;
        target[offset + 1] = (byte) (value >>> 8);
        target[offset + 2] = (byte) (value >>> 16);
        target[offset + 3] = (byte) (value >>> 24);
    }
}
