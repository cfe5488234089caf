package org.stackvm.runtime.isa;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class BytecodeWriterTest {

    @Test
    void writesInt32OperandsLittleEndian() {
        byte[] code = new BytecodeWriter().emit(Opcode.PUSH, 0x12345678).toByteArray();

        assertThat(code).containsExactly(1, 0x78, 0x56, 0x34, 0x12);
        assertThat(Bytecode.readInt32(code, 1)).isEqualTo(0x12345678);
    }

    @Test
    void negativeInt32RoundTripsThroughReader() {
        byte[] code = new BytecodeWriter().emit(Opcode.PUSH, -2).toByteArray();

        assertThat(code).containsExactly(1, 0xFE, 0xFF, 0xFF, 0xFF);
        assertThat(Bytecode.readInt32(code, 1)).isEqualTo(-2);
    }

    @Test
    void writesByteOperandAndNullTerminatedString() {
        BytecodeWriter writer = new BytecodeWriter()
                .emit(Opcode.LOAD_LOCAL, 3)
                .emit(Opcode.PRINT_STR, "Hi")
                .emit(Opcode.HALT);

        assertThat(writer.toByteArray()).containsExactly(
                Opcode.LOAD_LOCAL.code(), 3,
                Opcode.PRINT_STR.code(), 'H', 'i', 0,
                Opcode.HALT.code());
        assertThat(writer.size()).isEqualTo(7);
    }

    @Test
    void rejectsOperandsThatDoNotMatchTheEncoding() {
        BytecodeWriter writer = new BytecodeWriter();

        assertThatThrownBy(() -> writer.emit(Opcode.PUSH)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> writer.emit(Opcode.ADD, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> writer.emit(Opcode.PRINT_STR, new byte[]{'a', 0, 'b'}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(writer.size()).isZero();
    }

    @Test
    void failsWhenCapacityIsExceeded() {
        BytecodeWriter writer = new BytecodeWriter(6).emit(Opcode.PUSH, 1);

        assertThatThrownBy(() -> writer.emit(Opcode.PUSH, 2))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("overflow");
        writer.emit(Opcode.HALT);
        assertThat(writer.size()).isEqualTo(6);
    }
}
