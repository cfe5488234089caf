package org.stackvm.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stackvm.runtime.internal.services.ExecutionContext;
import org.stackvm.runtime.internal.services.StateFormatter;
import org.stackvm.runtime.isa.InstructionSet;
import org.stackvm.runtime.isa.Opcode;
import org.stackvm.runtime.model.BytecodeProgram;
import org.stackvm.runtime.model.FaultKind;
import org.stackvm.runtime.model.VmState;
import org.stackvm.runtime.model.VmStatus;
import org.stackvm.runtime.services.Disassembler;
import org.stackvm.runtime.spi.InputSource;
import org.stackvm.runtime.spi.OutputSink;

import java.util.Objects;
import java.util.Optional;

/**
 * The execution engine: a fetch-decode-execute loop over one {@link VmState}.
 * <p>
 * Each call to {@link #step()} fetches an opcode at the program counter, reads its
 * fixed-size operand and dispatches to the instruction family registered in
 * {@link InstructionSet}. Errors in the executed program never escape as exceptions;
 * they are recorded as a fault on the state, logged, and stop the machine.
 * A machine runs its program once; its state stays inspectable afterwards.
 */
public class VirtualMachine {

    private static final Logger LOG = LoggerFactory.getLogger(VirtualMachine.class);

    private final VmState state;
    private final OutputSink output;
    private final InputSource input;
    private final OutputSink diagnostics;
    private final boolean trace;
    private final Disassembler disassembler = new Disassembler();

    /**
     * Creates a machine with default limits, no input and tracing disabled.
     * Program output and diagnostics share the given sink.
     *
     * @param program The program to execute.
     * @param output  The sink for program output.
     */
    public VirtualMachine(BytecodeProgram program, OutputSink output) {
        this(program, VmLimits.DEFAULTS, output, InputSource.EMPTY, output, false);
    }

    /**
     * Creates a machine.
     *
     * @param program     The program to execute.
     * @param limits      The capacities of the machine.
     * @param output      The sink for PRINT, PRINT_CHAR and PRINT_STR.
     * @param input       The source for READ.
     * @param diagnostics The sink for DEBUG dumps and trace lines.
     * @param trace       Whether to trace every instruction.
     */
    public VirtualMachine(BytecodeProgram program, VmLimits limits, OutputSink output,
                          InputSource input, OutputSink diagnostics, boolean trace) {
        this.state = new VmState(program, limits);
        this.output = Objects.requireNonNull(output, "output");
        this.input = Objects.requireNonNull(input, "input");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.trace = trace;
    }

    /**
     * Runs the program until it halts, faults or runs off the end of the code.
     * READ may block on the input source; there is no timeout.
     *
     * @return The final status, {@link VmStatus#HALTED} or {@link VmStatus#FAULTED}.
     */
    public VmStatus run() {
        state.start();
        LOG.debug("Starting execution of {}", state.getProgram());
        while (state.isRunning()) {
            step();
        }
        output.flush();
        diagnostics.flush();
        LOG.debug("Execution ended with status {} after {} instructions",
                state.getStatus(), state.getInstructionCount());
        return state.getStatus();
    }

    /**
     * Executes a single instruction. Starts the machine if it has not run yet.
     * Does nothing once the machine has stopped.
     *
     * @return The status after the instruction.
     */
    public VmStatus step() {
        state.start();
        if (!state.isRunning()) {
            return state.getStatus();
        }
        BytecodeProgram program = state.getProgram();
        if (state.getPc() >= program.length()) {
            state.halt();
            return state.getStatus();
        }

        int address = state.getPc();
        state.setInstructionAddress(address);
        if (trace) {
            diagnostics.write(StateFormatter.traceLine(disassembler.decodeAt(program, address)));
        }

        int raw = state.readByte();
        state.countInstruction();
        Optional<Opcode> decoded = Opcode.fromByte(raw);
        if (decoded.isEmpty()) {
            state.fault(FaultKind.INVALID_OPCODE, String.format("0x%02X", raw));
            logFault();
            return state.getStatus();
        }

        Opcode opcode = decoded.get();
        int operand = switch (opcode.encoding()) {
            case BYTE -> state.readByte();
            case INT32 -> state.readInt32();
            default -> 0;
        };
        if (state.isFaulted()) {
            logFault();
            return state.getStatus();
        }

        InstructionSet.handlerFor(opcode)
                .execute(new ExecutionContext(state, opcode, operand, output, input, diagnostics));

        if (state.isFaulted()) {
            logFault();
        } else if (trace && state.isRunning()) {
            diagnostics.write(StateFormatter.stackDump(state.getStack()));
        }
        return state.getStatus();
    }

    private void logFault() {
        LOG.warn("{} at instruction {} (opcode address {})",
                state.getFault(), state.getInstructionCount(), state.getFault().instructionAddress());
    }

    /**
     * @return The state of this machine, live while running and final afterwards.
     */
    public VmState getState() {
        return state;
    }
}
