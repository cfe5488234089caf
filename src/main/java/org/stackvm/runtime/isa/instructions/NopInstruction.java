package org.stackvm.runtime.isa.instructions;

import org.stackvm.runtime.internal.services.ExecutionContext;
import org.stackvm.runtime.isa.Instruction;
import org.stackvm.runtime.isa.Opcode;

import java.util.EnumSet;
import java.util.Set;

/**
 * Represents the NOP (No Operation) instruction, which does nothing.
 */
public class NopInstruction extends Instruction {

    @Override
    public void execute(ExecutionContext context) {
        // This instruction intentionally does nothing.
    }

    @Override
    public Set<Opcode> opcodes() {
        return EnumSet.of(Opcode.NOP);
    }
}
