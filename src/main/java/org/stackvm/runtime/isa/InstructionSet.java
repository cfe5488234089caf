package org.stackvm.runtime.isa;

import org.stackvm.runtime.isa.instructions.ArithmeticInstruction;
import org.stackvm.runtime.isa.instructions.BitwiseInstruction;
import org.stackvm.runtime.isa.instructions.ComparisonInstruction;
import org.stackvm.runtime.isa.instructions.ControlFlowInstruction;
import org.stackvm.runtime.isa.instructions.IoInstruction;
import org.stackvm.runtime.isa.instructions.NopInstruction;
import org.stackvm.runtime.isa.instructions.StackInstruction;
import org.stackvm.runtime.isa.instructions.SystemInstruction;
import org.stackvm.runtime.isa.instructions.VariableInstruction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The dispatch table of the virtual machine: maps every opcode to the instruction family
 * that implements it. The table is built once and is read-only afterwards, so all
 * machines share it.
 */
public final class InstructionSet {

    private static final Map<Opcode, Instruction> HANDLERS;

    static {
        Map<Opcode, Instruction> handlers = new EnumMap<>(Opcode.class);
        List<Instruction> families = List.of(
                new NopInstruction(),
                new StackInstruction(),
                new ArithmeticInstruction(),
                new ComparisonInstruction(),
                new BitwiseInstruction(),
                new ControlFlowInstruction(),
                new VariableInstruction(),
                new IoInstruction(),
                new SystemInstruction());
        for (Instruction family : families) {
            registerFamily(handlers, family);
        }
        Set<Opcode> missing = EnumSet.complementOf(EnumSet.copyOf(handlers.keySet()));
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Opcodes without an instruction family: " + missing);
        }
        HANDLERS = Collections.unmodifiableMap(handlers);
    }

    private InstructionSet() {}

    private static void registerFamily(Map<Opcode, Instruction> handlers, Instruction family) {
        for (Opcode opcode : family.opcodes()) {
            Instruction previous = handlers.put(opcode, family);
            if (previous != null) {
                throw new IllegalStateException("Opcode " + opcode + " registered by both "
                        + previous.getClass().getSimpleName() + " and " + family.getClass().getSimpleName());
            }
        }
    }

    /**
     * @param opcode The opcode.
     * @return The family implementing it. Never null.
     */
    public static Instruction handlerFor(Opcode opcode) {
        return HANDLERS.get(opcode);
    }
}
