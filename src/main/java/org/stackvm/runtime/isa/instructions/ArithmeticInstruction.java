package org.stackvm.runtime.isa.instructions;

import org.stackvm.runtime.internal.services.ExecutionContext;
import org.stackvm.runtime.isa.Instruction;
import org.stackvm.runtime.isa.Opcode;
import org.stackvm.runtime.model.FaultKind;
import org.stackvm.runtime.model.VmState;

import java.util.EnumSet;
import java.util.Set;

/**
 * Handles the integer arithmetic instructions.
 * <p>
 * All results wrap around modulo 2^32, including {@code MIN_VALUE / -1}, which yields
 * {@code MIN_VALUE}. Division and modulo by zero fault after both operands were popped.
 */
public class ArithmeticInstruction extends Instruction {

    @Override
    public void execute(ExecutionContext context) {
        VmState state = context.getState();
        Opcode opcode = context.getOpcode();

        switch (opcode) {
            case NEG, INC, DEC -> {
                int a = state.pop();
                if (state.isFaulted()) return;
                state.push(unary(opcode, a));
            }
            default -> {
                int b = state.pop();
                int a = state.pop();
                if (state.isFaulted()) return;
                if ((opcode == Opcode.DIV || opcode == Opcode.MOD) && b == 0) {
                    state.fault(FaultKind.DIVISION_BY_ZERO, opcode.mnemonic());
                    return;
                }
                state.push(binary(opcode, a, b));
            }
        }
    }

    private static int unary(Opcode opcode, int a) {
        return switch (opcode) {
            case NEG -> -a;
            case INC -> a + 1;
            case DEC -> a - 1;
            default -> throw new IllegalStateException("Not a unary arithmetic instruction: " + opcode);
        };
    }

    private static int binary(Opcode opcode, int a, int b) {
        return switch (opcode) {
            case ADD -> a + b;
            case SUB -> a - b;
            case MUL -> a * b;
            case DIV -> a / b;
            case MOD -> a % b;
            default -> throw new IllegalStateException("Not a binary arithmetic instruction: " + opcode);
        };
    }

    @Override
    public Set<Opcode> opcodes() {
        return EnumSet.of(Opcode.ADD, Opcode.SUB, Opcode.MUL, Opcode.DIV, Opcode.MOD,
                Opcode.NEG, Opcode.INC, Opcode.DEC);
    }
}
