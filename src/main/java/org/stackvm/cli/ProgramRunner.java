package org.stackvm.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stackvm.assembler.Assembler;
import org.stackvm.assembler.AssemblyResult;
import org.stackvm.runtime.VirtualMachine;
import org.stackvm.runtime.VmLimits;
import org.stackvm.runtime.model.BytecodeProgram;
import org.stackvm.runtime.model.VmState;
import org.stackvm.runtime.model.VmStatus;
import org.stackvm.runtime.services.Disassembler;
import org.stackvm.runtime.spi.InputSource;
import org.stackvm.runtime.spi.OutputSink;
import org.stackvm.runtime.spi.PrintStreamOutputSink;

import java.io.PrintWriter;

/**
 * Assembles, lists and executes one program, printing a report to the console.
 * The report consists of a banner, the disassembly, the program output and run statistics.
 */
public class ProgramRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ProgramRunner.class);
    private static final String RULE = "========================================";

    private final VmLimits limits;
    private final boolean trace;
    private final PrintWriter out;
    private final PrintWriter err;
    private final InputSource input;
    private final Assembler assembler;
    private final Disassembler disassembler = new Disassembler();

    /**
     * @param limits The capacities to assemble and run with.
     * @param trace  Whether to trace every instruction.
     * @param out    The console for reports and program output.
     * @param err    The console for errors.
     * @param input  The source for READ.
     */
    public ProgramRunner(VmLimits limits, boolean trace, PrintWriter out, PrintWriter err, InputSource input) {
        this.limits = limits;
        this.trace = trace;
        this.out = out;
        this.err = err;
        this.input = input;
        this.assembler = new Assembler(limits);
    }

    /**
     * Runs one program.
     * @param title  The name shown in the banner and in errors.
     * @param source The assembly source.
     * @return false if the program failed to assemble. A program that faults at run time counts as run.
     */
    public boolean run(String title, String source) {
        out.println();
        out.println(RULE);
        out.println("Running: " + title);
        out.println(RULE);
        out.println();

        AssemblyResult result = assembler.assemble(source, title);
        if (!result.isSuccess()) {
            err.println(result.error());
            err.println("    > " + result.error().lineContent().strip());
            err.println("Assembly failed!");
            err.flush();
            return false;
        }
        BytecodeProgram program = result.program();
        out.println("Assembly successful: " + program.length() + " bytes");
        out.println();
        out.println(disassembler.render(program));

        out.println("=== Execution ===");
        out.flush();
        OutputSink console = new PrintStreamOutputSink(out);
        VirtualMachine vm = new VirtualMachine(program, limits, console, input, console, trace);
        VmStatus status = vm.run();
        VmState state = vm.getState();
        if (status == VmStatus.FAULTED) {
            err.println(state.getFault());
            err.flush();
        }
        LOG.debug("Program '{}' finished with status {}", title, status);

        out.println();
        out.println("=== Statistics ===");
        out.println("Instructions executed: " + state.getInstructionCount());
        out.println("Final stack pointer: " + state.getStackPointer());
        out.println("==================");
        out.flush();
        return true;
    }
}
