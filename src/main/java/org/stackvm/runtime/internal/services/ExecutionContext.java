package org.stackvm.runtime.internal.services;

import org.stackvm.runtime.isa.Opcode;
import org.stackvm.runtime.model.VmState;
import org.stackvm.runtime.spi.InputSource;
import org.stackvm.runtime.spi.OutputSink;

/**
 * Encapsulates everything an instruction needs while it executes.
 * This object is created by the VirtualMachine for every instruction and passed to the
 * executing family to avoid global access.
 */
public class ExecutionContext {

    private final VmState state;
    private final Opcode opcode;
    private final int operand;
    private final OutputSink output;
    private final InputSource input;
    private final OutputSink diagnostics;

    /**
     * Constructs a new ExecutionContext.
     * @param state       The machine state.
     * @param opcode      The decoded opcode.
     * @param operand     The decoded fixed-size operand, 0 if the opcode has none.
     * @param output      The sink for PRINT instructions.
     * @param input       The source for READ.
     * @param diagnostics The sink for DEBUG stack dumps.
     */
    public ExecutionContext(VmState state, Opcode opcode, int operand,
                            OutputSink output, InputSource input, OutputSink diagnostics) {
        this.state = state;
        this.opcode = opcode;
        this.operand = operand;
        this.output = output;
        this.input = input;
        this.diagnostics = diagnostics;
    }

    public VmState getState() {
        return state;
    }

    public Opcode getOpcode() {
        return opcode;
    }

    /**
     * @return The operand as decoded from the code stream (signed for INT32, 0..255 for BYTE).
     */
    public int getOperand() {
        return operand;
    }

    public OutputSink getOutput() {
        return output;
    }

    public InputSource getInput() {
        return input;
    }

    public OutputSink getDiagnostics() {
        return diagnostics;
    }
}
