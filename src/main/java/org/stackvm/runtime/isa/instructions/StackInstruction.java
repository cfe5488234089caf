package org.stackvm.runtime.isa.instructions;

import org.stackvm.runtime.internal.services.ExecutionContext;
import org.stackvm.runtime.isa.Instruction;
import org.stackvm.runtime.isa.Opcode;
import org.stackvm.runtime.model.VmState;

import java.util.EnumSet;
import java.util.Set;

/**
 * Handles stack manipulation instructions: PUSH, POP, DUP, SWAP and OVER.
 */
public class StackInstruction extends Instruction {

    @Override
    public void execute(ExecutionContext context) {
        VmState state = context.getState();

        switch (context.getOpcode()) {
            case PUSH -> state.push(context.getOperand());
            case POP -> state.pop();
            case DUP -> {
                int top = state.peek(0);
                if (state.isFaulted()) return;
                state.push(top);
            }
            case SWAP -> {
                int b = state.pop();
                int a = state.pop();
                if (state.isFaulted()) return;
                state.push(b);
                state.push(a);
            }
            case OVER -> {
                int second = state.peek(1);
                if (state.isFaulted()) return;
                state.push(second);
            }
            default -> throw new IllegalStateException("Not a stack instruction: " + context.getOpcode());
        }
    }

    @Override
    public Set<Opcode> opcodes() {
        return EnumSet.of(Opcode.PUSH, Opcode.POP, Opcode.DUP, Opcode.SWAP, Opcode.OVER);
    }
}
