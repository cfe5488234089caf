package org.stackvm.runtime.isa.instructions;

import org.stackvm.runtime.internal.services.ExecutionContext;
import org.stackvm.runtime.internal.services.StateFormatter;
import org.stackvm.runtime.isa.Instruction;
import org.stackvm.runtime.isa.Opcode;

import java.util.EnumSet;
import java.util.Set;

/**
 * Handles HALT, which stops the machine, and DEBUG, which dumps the operand stack
 * to the diagnostic sink.
 */
public class SystemInstruction extends Instruction {

    @Override
    public void execute(ExecutionContext context) {
        switch (context.getOpcode()) {
            case HALT -> context.getState().halt();
            case DEBUG -> context.getDiagnostics().write(StateFormatter.stackDump(context.getState().getStack()));
            default -> throw new IllegalStateException("Not a system instruction: " + context.getOpcode());
        }
    }

    @Override
    public Set<Opcode> opcodes() {
        return EnumSet.of(Opcode.HALT, Opcode.DEBUG);
    }
}
