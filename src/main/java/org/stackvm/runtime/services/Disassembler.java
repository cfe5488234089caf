package org.stackvm.runtime.services;

import org.stackvm.runtime.isa.Opcode;
import org.stackvm.runtime.isa.OperandEncoding;
import org.stackvm.runtime.model.BytecodeProgram;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Decodes bytecode back into readable instructions without executing it.
 * <p>
 * The scan is linear and best-effort: a byte that is not a valid opcode is reported as
 * invalid and the scan resumes at the next byte. An operand cut off by the end of the
 * code is reported as truncated and ends the scan. The program is never modified.
 */
public class Disassembler {

    private static final String HEADER = "=== Disassembly ===\n"
            + "Address  Opcode       Operand\n"
            + "-------  -----------  ----------\n";
    private static final String FOOTER = "===================\n";

    /**
     * Disassembles a complete program.
     * @param program The program.
     * @return One entry per decoded instruction or invalid byte, in address order.
     */
    public List<DisassembledInstruction> disassemble(BytecodeProgram program) {
        List<DisassembledInstruction> result = new ArrayList<>();
        int address = 0;
        while (address < program.length()) {
            DisassembledInstruction insn = decodeAt(program, address);
            result.add(insn);
            if (insn.truncated()) {
                break;
            }
            address += insn.length();
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Disassembles raw bytecode.
     * @param code The bytes.
     * @return One entry per decoded instruction or invalid byte, in address order.
     */
    public List<DisassembledInstruction> disassemble(byte[] code) {
        return disassemble(BytecodeProgram.of(code));
    }

    /**
     * Decodes the single instruction starting at the given address.
     *
     * @param program The program.
     * @param address The address of the opcode byte; must be inside the program.
     * @return The decoded instruction.
     * @throws IndexOutOfBoundsException if the address is outside the program.
     */
    public DisassembledInstruction decodeAt(BytecodeProgram program, int address) {
        if (address < 0 || address >= program.length()) {
            throw new IndexOutOfBoundsException("Address " + address + " outside program of length " + program.length());
        }
        int raw = program.byteAt(address);
        Optional<Opcode> decoded = Opcode.fromByte(raw);
        if (decoded.isEmpty()) {
            return new DisassembledInstruction(address, raw, null, null, null, 1, false);
        }
        Opcode opcode = decoded.get();
        int operandStart = address + 1;
        OperandEncoding encoding = opcode.encoding();

        switch (encoding) {
            case NONE:
                return new DisassembledInstruction(address, raw, opcode, null, null, 1, false);
            case BYTE:
            case INT32:
                if (!program.hasBytes(operandStart, encoding.size())) {
                    return new DisassembledInstruction(address, raw, opcode, null, null,
                            program.length() - address, true);
                }
                int operand = encoding == OperandEncoding.BYTE
                        ? program.byteAt(operandStart)
                        : program.readInt32(operandStart);
                return new DisassembledInstruction(address, raw, opcode, operand, null, opcode.fixedLength(), false);
            case STRING:
                int end = program.findTerminator(operandStart);
                String text = new String(program.slice(operandStart, end), StandardCharsets.UTF_8);
                boolean terminated = end < program.length();
                int length = terminated ? end + 1 - address : end - address;
                return new DisassembledInstruction(address, raw, opcode, null, text, length, !terminated);
            default:
                throw new IllegalStateException("Unhandled operand encoding: " + encoding);
        }
    }

    /**
     * Renders a listing with one row per entry.
     * @param instructions The decoded instructions.
     * @return The listing, including header and footer lines.
     */
    public String render(List<DisassembledInstruction> instructions) {
        StringBuilder sb = new StringBuilder(HEADER);
        for (DisassembledInstruction insn : instructions) {
            sb.append(String.format("%04d     %-12s %s", insn.address(), insn.mnemonic(), insn.operandText()))
                    .append('\n');
        }
        return sb.append(FOOTER).toString();
    }

    /**
     * Disassembles and renders a program in one step.
     * @param program The program.
     * @return The listing.
     */
    public String render(BytecodeProgram program) {
        return render(disassemble(program));
    }
}
