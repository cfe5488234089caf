package org.stackvm.runtime.isa.instructions;

import org.stackvm.runtime.internal.services.ExecutionContext;
import org.stackvm.runtime.isa.Instruction;
import org.stackvm.runtime.isa.Opcode;
import org.stackvm.runtime.model.VmState;

import java.util.EnumSet;
import java.util.Set;

/**
 * Handles the signed comparison instructions. Each pops b, then a, and pushes
 * 1 if {@code a <op> b} holds, 0 otherwise.
 */
public class ComparisonInstruction extends Instruction {

    @Override
    public void execute(ExecutionContext context) {
        VmState state = context.getState();
        int b = state.pop();
        int a = state.pop();
        if (state.isFaulted()) return;

        boolean result = switch (context.getOpcode()) {
            case EQ -> a == b;
            case NE -> a != b;
            case LT -> a < b;
            case LE -> a <= b;
            case GT -> a > b;
            case GE -> a >= b;
            default -> throw new IllegalStateException("Not a comparison instruction: " + context.getOpcode());
        };
        state.push(result ? 1 : 0);
    }

    @Override
    public Set<Opcode> opcodes() {
        return EnumSet.of(Opcode.EQ, Opcode.NE, Opcode.LT, Opcode.LE, Opcode.GT, Opcode.GE);
    }
}
