package org.stackvm.runtime.isa.instructions;

import org.stackvm.runtime.internal.services.ExecutionContext;
import org.stackvm.runtime.isa.Instruction;
import org.stackvm.runtime.isa.Opcode;
import org.stackvm.runtime.model.BytecodeProgram;
import org.stackvm.runtime.model.VmState;

import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Handles console input and output.
 * <p>
 * Output is text. PRINT_CHAR writes the character whose code is the low 8 bits of the
 * value (ISO-8859-1), so 0xE9 prints as {@code é} and the sink encodes it for its console.
 * PRINT_STR decodes its payload as UTF-8.
 */
public class IoInstruction extends Instruction {

    @Override
    public void execute(ExecutionContext context) {
        VmState state = context.getState();

        switch (context.getOpcode()) {
            case PRINT -> {
                int value = state.pop();
                if (state.isFaulted()) return;
                context.getOutput().write(value + "\n");
            }
            case PRINT_CHAR -> {
                int value = state.pop();
                if (state.isFaulted()) return;
                context.getOutput().write((char) (value & 0xFF));
            }
            case PRINT_STR -> printInlineString(context, state);
            case READ -> {
                OptionalInt value = context.getInput().readInt();
                state.push(value.orElse(0));
            }
            default -> throw new IllegalStateException("Not an I/O instruction: " + context.getOpcode());
        }
    }

    /**
     * Writes the null-terminated payload that follows the opcode and moves the program
     * counter past the terminator. An unterminated payload runs to the end of the code.
     */
    private static void printInlineString(ExecutionContext context, VmState state) {
        BytecodeProgram program = state.getProgram();
        int start = state.getPc();
        int end = program.findTerminator(start);
        if (end > start) {
            context.getOutput().write(new String(program.slice(start, end), StandardCharsets.UTF_8));
        }
        state.setPc(Math.min(end + 1, program.length()));
    }

    @Override
    public Set<Opcode> opcodes() {
        return EnumSet.of(Opcode.PRINT, Opcode.PRINT_CHAR, Opcode.PRINT_STR, Opcode.READ);
    }
}
