package org.stackvm.runtime.isa;

import org.stackvm.runtime.internal.services.ExecutionContext;

import java.util.Set;

/**
 * The abstract base class for all instruction families of the virtual machine.
 * <p>
 * A family implements the semantics of a group of related opcodes. Families are
 * stateless; all run state lives in the {@link ExecutionContext}. An instruction that
 * hits an error records a fault on the state and returns.
 */
public abstract class Instruction {

    /**
     * Executes one instruction. The opcode and its fixed-size operand have already been
     * fetched; the program counter points past them.
     * @param context The execution context.
     */
    public abstract void execute(ExecutionContext context);

    /**
     * @return The opcodes this family implements.
     */
    public abstract Set<Opcode> opcodes();
}
