package org.stackvm.runtime.instructions;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stackvm.runtime.isa.BytecodeWriter;
import org.stackvm.runtime.isa.Opcode;
import org.stackvm.runtime.model.FaultKind;
import org.stackvm.runtime.model.VmState;
import org.stackvm.runtime.model.VmStatus;
import org.stackvm.runtime.testing.VmRunner;

import static org.assertj.core.api.Assertions.assertThat;

public class VMStackInstructionTest {

    private static VmState run(BytecodeWriter code) {
        return VmRunner.run(code.emit(Opcode.HALT)).vm.getState();
    }

    @Test
    @Tag("unit")
    void testPushAndPop() {
        VmState state = run(new BytecodeWriter()
                .emit(Opcode.PUSH, 7)
                .emit(Opcode.PUSH, -3)
                .emit(Opcode.POP));
        assertThat(state.getStack().toArray()).containsExactly(7);
        assertThat(state.getStatus()).isEqualTo(VmStatus.HALTED);
    }

    @Test
    @Tag("unit")
    void testDup() {
        VmState state = run(new BytecodeWriter().emit(Opcode.PUSH, 4).emit(Opcode.DUP));
        assertThat(state.getStack().toArray()).containsExactly(4, 4);
    }

    @Test
    @Tag("unit")
    void testSwap() {
        VmState state = run(new BytecodeWriter().emit(Opcode.PUSH, 1).emit(Opcode.PUSH, 2).emit(Opcode.SWAP));
        assertThat(state.getStack().toArray()).containsExactly(2, 1);
    }

    @Test
    @Tag("unit")
    void testOver() {
        VmState state = run(new BytecodeWriter().emit(Opcode.PUSH, 1).emit(Opcode.PUSH, 2).emit(Opcode.OVER));
        assertThat(state.getStack().toArray()).containsExactly(1, 2, 1);
    }

    @Test
    @Tag("unit")
    void testPopOnEmptyStackFaults() {
        VmState state = run(new BytecodeWriter().emit(Opcode.POP));
        assertThat(state.getStatus()).isEqualTo(VmStatus.FAULTED);
        assertThat(state.getFault().kind()).isEqualTo(FaultKind.STACK_UNDERFLOW);
    }

    @Test
    @Tag("unit")
    void testDupOnEmptyStackFaults() {
        VmState state = run(new BytecodeWriter().emit(Opcode.DUP));
        assertThat(state.getFault().kind()).isEqualTo(FaultKind.STACK_UNDERFLOW);
        assertThat(state.getStackPointer()).isZero();
    }

    @Test
    @Tag("unit")
    void testOverWithOneValueFaultsWithoutPushing() {
        VmState state = run(new BytecodeWriter().emit(Opcode.PUSH, 9).emit(Opcode.OVER));
        assertThat(state.getFault().kind()).isEqualTo(FaultKind.STACK_UNDERFLOW);
        assertThat(state.getStack().toArray()).containsExactly(9);
    }
}
