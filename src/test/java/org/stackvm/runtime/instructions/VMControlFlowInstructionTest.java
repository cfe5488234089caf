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

public class VMControlFlowInstructionTest {

    private static VmState run(BytecodeWriter code) {
        return VmRunner.run(code).vm.getState();
    }

    @Test
    @Tag("unit")
    void testJmpSkipsCode() {
        VmState state = run(new BytecodeWriter()
                .emit(Opcode.JMP, 10)     // 0
                .emit(Opcode.PUSH, 1)     // 5
                .emit(Opcode.PUSH, 2)     // 10
                .emit(Opcode.HALT));      // 15
        assertThat(state.getStack().toArray()).containsExactly(2);
    }

    @Test
    @Tag("unit")
    void testJzTakenOnZero() {
        VmState state = run(conditional(Opcode.JZ, 0));
        assertThat(state.getStack().toArray()).containsExactly(2);
    }

    @Test
    @Tag("unit")
    void testJzFallsThroughOnNonZero() {
        VmState state = run(conditional(Opcode.JZ, 5));
        assertThat(state.getStack().toArray()).containsExactly(1);
    }

    @Test
    @Tag("unit")
    void testJnzTakenOnNonZero() {
        VmState state = run(conditional(Opcode.JNZ, -1));
        assertThat(state.getStack().toArray()).containsExactly(2);
    }

    @Test
    @Tag("unit")
    void testJnzFallsThroughOnZero() {
        VmState state = run(conditional(Opcode.JNZ, 0));
        assertThat(state.getStack().toArray()).containsExactly(1);
    }

    private static BytecodeWriter conditional(Opcode jump, int condition) {
        return new BytecodeWriter()
                .emit(Opcode.PUSH, condition)   // 0
                .emit(jump, 16)                 // 5
                .emit(Opcode.PUSH, 1)           // 10
                .emit(Opcode.HALT)              // 15
                .emit(Opcode.PUSH, 2)           // 16
                .emit(Opcode.HALT);             // 21
    }

    @Test
    @Tag("unit")
    void testCallAndReturn() {
        VmState state = run(new BytecodeWriter()
                .emit(Opcode.PUSH, 3)     // 0
                .emit(Opcode.CALL, 12)    // 5
                .emit(Opcode.HALT)        // 10
                .emit(Opcode.NOP)         // 11
                .emit(Opcode.INC)         // 12
                .emit(Opcode.RET));       // 13

        assertThat(state.getStatus()).isEqualTo(VmStatus.HALTED);
        assertThat(state.getStack().toArray()).containsExactly(4);
        assertThat(state.getCallDepth()).isZero();
        assertThat(state.getPc()).isEqualTo(11);
    }

    @Test
    @Tag("unit")
    void testRetAtTopLevelHalts() {
        VmState state = run(new BytecodeWriter()
                .emit(Opcode.PUSH, 1)
                .emit(Opcode.RET)
                .emit(Opcode.PUSH, 2));

        assertThat(state.getStatus()).isEqualTo(VmStatus.HALTED);
        assertThat(state.getFault()).isNull();
        assertThat(state.getStack().toArray()).containsExactly(1);
    }

    @Test
    @Tag("unit")
    void testUnboundedRecursionOverflowsCallStack() {
        VmState state = run(new BytecodeWriter().emit(Opcode.CALL, 0));

        assertThat(state.getStatus()).isEqualTo(VmStatus.FAULTED);
        assertThat(state.getFault().kind()).isEqualTo(FaultKind.CALL_STACK_OVERFLOW);
        assertThat(state.getCallDepth()).isEqualTo(64);
        assertThat(state.getInstructionCount()).isEqualTo(65);
    }

    @Test
    @Tag("unit")
    void testJumpPastEndOfCodeFaults() {
        VmState state = run(new BytecodeWriter().emit(Opcode.JMP, 1000));
        assertThat(state.getFault().kind()).isEqualTo(FaultKind.INVALID_ADDRESS);
    }

    @Test
    @Tag("unit")
    void testJumpTargetIsUnsigned() {
        VmState state = run(new BytecodeWriter().emit(Opcode.JMP, -1));
        assertThat(state.getFault().kind()).isEqualTo(FaultKind.INVALID_ADDRESS);
    }

    @Test
    @Tag("unit")
    void testJumpToEndOfCodeHalts() {
        VmState state = run(new BytecodeWriter().emit(Opcode.JMP, 5));
        assertThat(state.getStatus()).isEqualTo(VmStatus.HALTED);
        assertThat(state.getInstructionCount()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void testConditionalJumpOnEmptyStackFaults() {
        VmState state = run(new BytecodeWriter().emit(Opcode.JZ, 0));
        assertThat(state.getFault().kind()).isEqualTo(FaultKind.STACK_UNDERFLOW);
    }
}
