package org.stackvm.runtime.internal.services;

import org.stackvm.runtime.Config;
import org.stackvm.runtime.model.OperandStack;
import org.stackvm.runtime.services.DisassembledInstruction;

/**
 * Formats stack dumps and trace lines in the layout shared by DEBUG and tracing.
 */
public final class StateFormatter {

    private StateFormatter() {}

    /**
     * Formats the operand stack, bottom first, showing at most {@link Config#STACK_DUMP_LIMIT} entries.
     * @param stack The stack.
     * @return e.g. {@code "  Stack [2]: 10 20 \n"} or {@code "  Stack [0]: (empty)\n"}.
     */
    public static String stackDump(OperandStack stack) {
        StringBuilder sb = new StringBuilder();
        sb.append("  Stack [").append(stack.size()).append("]: ");
        if (stack.isEmpty()) {
            sb.append("(empty)");
        } else {
            int shown = Math.min(stack.size(), Config.STACK_DUMP_LIMIT);
            for (int i = 0; i < shown; i++) {
                sb.append(stack.get(i)).append(' ');
            }
            if (stack.size() > Config.STACK_DUMP_LIMIT) {
                sb.append("... ");
            }
        }
        return sb.append('\n').toString();
    }

    /**
     * Formats the trace line for an instruction about to execute.
     * @param insn The decoded instruction.
     * @return e.g. {@code "[0005] PUSH         20         \n"}.
     */
    public static String traceLine(DisassembledInstruction insn) {
        String operand;
        if (insn.stringOperand() != null) {
            operand = "\"" + insn.stringOperand() + "\" ";
        } else if (insn.operand() != null) {
            operand = String.format("%-10d ", insn.operand());
        } else {
            operand = String.format("%-10s ", "");
        }
        return String.format("[%04d] %-12s %s\n", insn.address(), insn.mnemonic(), operand);
    }
}
