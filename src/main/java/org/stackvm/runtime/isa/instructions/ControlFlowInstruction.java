package org.stackvm.runtime.isa.instructions;

import org.stackvm.runtime.internal.services.ExecutionContext;
import org.stackvm.runtime.isa.Instruction;
import org.stackvm.runtime.isa.Opcode;
import org.stackvm.runtime.model.CallFrame;
import org.stackvm.runtime.model.VmState;

import java.util.EnumSet;
import java.util.Set;

/**
 * Handles jumps, calls and returns.
 * <p>
 * Target addresses are absolute and read as unsigned 32-bit values. A conditional jump
 * pops its condition; when it is not taken, execution continues after the operand.
 * RET does not restore the stack pointer, so a function leaves its results on the stack.
 */
public class ControlFlowInstruction extends Instruction {

    @Override
    public void execute(ExecutionContext context) {
        VmState state = context.getState();
        long target = Integer.toUnsignedLong(context.getOperand());

        switch (context.getOpcode()) {
            case JMP -> state.jumpTo(target);
            case JZ -> {
                int condition = state.pop();
                if (state.isFaulted()) return;
                if (condition == 0) {
                    state.jumpTo(target);
                }
            }
            case JNZ -> {
                int condition = state.pop();
                if (state.isFaulted()) return;
                if (condition != 0) {
                    state.jumpTo(target);
                }
            }
            case CALL -> {
                if (!state.pushFrame(state.getPc())) return;
                state.jumpTo(target);
            }
            case RET -> {
                if (!state.hasActiveFrame()) {
                    // Returning from the top level ends the program.
                    state.halt();
                    return;
                }
                CallFrame frame = state.popFrame();
                state.setPc(frame.getReturnAddress());
            }
            default -> throw new IllegalStateException("Not a control flow instruction: " + context.getOpcode());
        }
    }

    @Override
    public Set<Opcode> opcodes() {
        return EnumSet.of(Opcode.JMP, Opcode.JZ, Opcode.JNZ, Opcode.CALL, Opcode.RET);
    }
}
