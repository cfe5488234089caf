package org.stackvm.assembler;

import org.stackvm.runtime.isa.BytecodeWriter;
import org.stackvm.runtime.isa.Opcode;
import org.stackvm.runtime.isa.OperandEncoding;
import org.stackvm.runtime.model.BytecodeProgram;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the two assembler passes over a list of source lines.
 * <p>
 * The first pass records the address of every label and sizes every instruction, using
 * a placeholder for label references. The second pass emits the bytecode with all
 * references resolved. Both passes size instructions identically; a mismatch is reported
 * as an internal error. Any error aborts with an {@link AssemblerAbort}.
 */
class PassManager {

    private final AssemblerContext context;

    PassManager(AssemblerContext context) {
        this.context = context;
    }

    /**
     * Runs both passes.
     * @param lines The source lines.
     * @return The assembled program.
     */
    BytecodeProgram runPasses(List<SourceLine> lines) {
        List<ParsedLine> parsed = new ArrayList<>(lines.size());
        for (SourceLine line : lines) {
            parsed.add(LineParser.parse(line));
        }
        int firstPassSize = performFirstPass(parsed);
        BytecodeProgram program = performSecondPass(parsed);
        if (program.length() != firstPassSize) {
            throw abort(AssemblyErrorCode.INTERNAL_ERROR, null, firstPassSize, program.length());
        }
        return program;
    }

    private int performFirstPass(List<ParsedLine> lines) {
        context.resetAddress();
        for (ParsedLine line : lines) {
            if (line.label() != null) {
                processLabel(line);
            }
            if (!line.hasInstruction()) continue;

            Opcode opcode = lookupOpcode(line);
            int size = switch (opcode.encoding()) {
                case NONE, BYTE, INT32 -> {
                    encodeNumericOperand(line, opcode, false);
                    yield opcode.fixedLength();
                }
                case STRING -> opcode.encodedLength(decodeStringOperand(line).length);
            };
            if ((long) context.getAddress() + size > context.getLimits().codeCapacity()) {
                throw abort(AssemblyErrorCode.CODE_CAPACITY_EXCEEDED, line, context.getLimits().codeCapacity());
            }
            context.advance(size);
        }
        return context.getAddress();
    }

    private void processLabel(ParsedLine line) {
        String label = line.label();
        if (context.hasLabel(label)) {
            throw abort(AssemblyErrorCode.DUPLICATE_LABEL, line, label);
        }
        if (context.labelCount() >= context.getLimits().maxLabels()) {
            throw abort(AssemblyErrorCode.TOO_MANY_LABELS, line, context.getLimits().maxLabels());
        }
        context.defineLabel(label);
    }

    private BytecodeProgram performSecondPass(List<ParsedLine> lines) {
        context.resetAddress();
        BytecodeWriter writer = new BytecodeWriter(context.getLimits().codeCapacity());
        for (ParsedLine line : lines) {
            if (!line.hasInstruction()) continue;
            Opcode opcode = lookupOpcode(line);
            try {
                switch (opcode.encoding()) {
                    case NONE -> writer.emit(opcode);
                    case BYTE, INT32 -> writer.emit(opcode, encodeNumericOperand(line, opcode, true));
                    case STRING -> writer.emit(opcode, decodeStringOperand(line));
                }
            } catch (IllegalStateException e) {
                throw abort(AssemblyErrorCode.CODE_CAPACITY_EXCEEDED, line, context.getLimits().codeCapacity());
            }
        }
        return writer.toProgram();
    }

    private Opcode lookupOpcode(ParsedLine line) {
        return Opcode.byMnemonic(line.mnemonic())
                .orElseThrow(() -> abort(AssemblyErrorCode.UNKNOWN_MNEMONIC, line, line.mnemonic()));
    }

    /**
     * Validates the operand of a fixed-size instruction and returns its value.
     * A non-numeric INT32 operand must be a single label name; it resolves to 0 in the first pass.
     */
    private int encodeNumericOperand(ParsedLine line, Opcode opcode, boolean resolveLabels) {
        String operand = line.operand();
        if (opcode.encoding() == OperandEncoding.NONE) {
            if (line.hasOperand()) {
                throw abort(AssemblyErrorCode.UNEXPECTED_OPERAND, line, opcode.mnemonic(), operand);
            }
            return 0;
        }
        if (!line.hasOperand()) {
            throw abort(AssemblyErrorCode.MISSING_OPERAND, line, opcode.mnemonic());
        }
        if (NumericParser.isNumeric(operand)) {
            int value;
            try {
                value = NumericParser.parseInt(operand);
            } catch (NumberFormatException e) {
                throw abort(AssemblyErrorCode.INVALID_OPERAND, line, opcode.mnemonic(), operand);
            }
            if (opcode.encoding() == OperandEncoding.BYTE && (value < 0 || value > 0xFF)) {
                throw abort(AssemblyErrorCode.INVALID_OPERAND, line, opcode.mnemonic(), operand);
            }
            return value;
        }
        if (opcode.encoding() == OperandEncoding.BYTE || !LineParser.isLabelName(operand)) {
            throw abort(AssemblyErrorCode.INVALID_OPERAND, line, opcode.mnemonic(), operand);
        }
        if (!resolveLabels) {
            return 0;
        }
        return context.resolve(operand)
                .orElseThrow(() -> abort(AssemblyErrorCode.UNDEFINED_LABEL, line, operand));
    }

    /**
     * Extracts the payload between the first and the last quote of the operand and
     * processes escape sequences. Text outside the quotes is ignored.
     */
    private byte[] decodeStringOperand(ParsedLine line) {
        String operand = line.operand();
        int start = operand.indexOf('"');
        int end = operand.lastIndexOf('"');
        if (start < 0 && operand.isEmpty()) {
            throw abort(AssemblyErrorCode.MISSING_OPERAND, line, line.mnemonic());
        }
        if (start < 0 || end <= start) {
            throw abort(AssemblyErrorCode.UNTERMINATED_STRING, line, operand);
        }

        StringBuilder sb = new StringBuilder();
        for (int i = start + 1; i < end; i++) {
            char c = operand.charAt(i);
            if (c == '\\' && i + 1 < end) {
                char escaped = operand.charAt(++i);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }
        if (sb.indexOf("\0") >= 0) {
            throw abort(AssemblyErrorCode.INVALID_OPERAND, line, line.mnemonic(), operand);
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    private AssemblerAbort abort(AssemblyErrorCode code, ParsedLine line, Object... args) {
        String message = Messages.format(code, args);
        AssemblyError error = line == null
                ? new AssemblyError(code, message, context.getProgramName(), -1, "")
                : new AssemblyError(code, message, context.getProgramName(),
                        line.source().lineNumber(), line.source().content());
        return new AssemblerAbort(error);
    }
}
