package org.stackvm.runtime.isa.instructions;

import org.stackvm.runtime.internal.services.ExecutionContext;
import org.stackvm.runtime.isa.Instruction;
import org.stackvm.runtime.isa.Opcode;
import org.stackvm.runtime.model.VmState;

import java.util.EnumSet;
import java.util.Set;

/**
 * Handles access to local and global variables.
 * <p>
 * Local slots belong to the active call frame; at top level they alias the globals
 * with the same index. Global indices are unsigned.
 */
public class VariableInstruction extends Instruction {

    @Override
    public void execute(ExecutionContext context) {
        VmState state = context.getState();
        int operand = context.getOperand();

        switch (context.getOpcode()) {
            case LOAD_LOCAL -> {
                int value = state.loadLocal(operand);
                if (state.isFaulted()) return;
                state.push(value);
            }
            case STORE_LOCAL -> {
                int value = state.pop();
                if (state.isFaulted()) return;
                state.storeLocal(operand, value);
            }
            case LOAD_GLOBAL -> {
                int value = state.loadGlobal(Integer.toUnsignedLong(operand));
                if (state.isFaulted()) return;
                state.push(value);
            }
            case STORE_GLOBAL -> {
                int value = state.pop();
                if (state.isFaulted()) return;
                state.storeGlobal(Integer.toUnsignedLong(operand), value);
            }
            default -> throw new IllegalStateException("Not a variable instruction: " + context.getOpcode());
        }
    }

    @Override
    public Set<Opcode> opcodes() {
        return EnumSet.of(Opcode.LOAD_LOCAL, Opcode.STORE_LOCAL, Opcode.LOAD_GLOBAL, Opcode.STORE_GLOBAL);
    }
}
