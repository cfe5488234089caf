package org.stackvm.runtime.isa.instructions;

import org.stackvm.runtime.internal.services.ExecutionContext;
import org.stackvm.runtime.isa.Instruction;
import org.stackvm.runtime.isa.Opcode;
import org.stackvm.runtime.model.VmState;

import java.util.EnumSet;
import java.util.Set;

/**
 * Handles logical (AND, OR, NOT) and bitwise (BAND, BOR, BNOT, XOR, SHL, SHR) instructions.
 * <p>
 * Logical operators treat any non-zero value as true and push 1 or 0.
 * Shift counts use their low 5 bits; SHR shifts in zeros.
 */
public class BitwiseInstruction extends Instruction {

    @Override
    public void execute(ExecutionContext context) {
        VmState state = context.getState();
        Opcode opcode = context.getOpcode();

        if (opcode == Opcode.NOT || opcode == Opcode.BNOT) {
            int a = state.pop();
            if (state.isFaulted()) return;
            state.push(opcode == Opcode.NOT ? (a == 0 ? 1 : 0) : ~a);
            return;
        }

        int b = state.pop();
        int a = state.pop();
        if (state.isFaulted()) return;

        int result = switch (opcode) {
            case AND -> (a != 0 && b != 0) ? 1 : 0;
            case OR -> (a != 0 || b != 0) ? 1 : 0;
            case BAND -> a & b;
            case BOR -> a | b;
            case XOR -> a ^ b;
            case SHL -> a << (b & 31);
            case SHR -> a >>> (b & 31);
            default -> throw new IllegalStateException("Not a bitwise instruction: " + opcode);
        };
        state.push(result);
    }

    @Override
    public Set<Opcode> opcodes() {
        return EnumSet.of(Opcode.AND, Opcode.OR, Opcode.NOT, Opcode.BAND, Opcode.BOR,
                Opcode.BNOT, Opcode.XOR, Opcode.SHL, Opcode.SHR);
    }
}
