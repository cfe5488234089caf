package org.stackvm.cli.commands;

import com.typesafe.config.Config;
import org.stackvm.cli.CommandLineInterface;
import org.stackvm.cli.ProgramRunner;
import org.stackvm.runtime.VmLimits;
import org.stackvm.runtime.isa.Opcode;
import org.stackvm.runtime.spi.ScannerInputSource;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "run", description = "Assembles and executes a bundled program or an assembly file.")
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", defaultValue = ProgramSource.ALL,
            description = "Program to run: factorial, fibonacci, nested, arithmetic or all (default: all).")
    private String program;

    @Option(names = {"-d", "--debug"}, description = "Enable instruction tracing.")
    private boolean debug;

    @Option(names = {"-f", "--file"}, description = "Run the given assembly file instead of a bundled program.")
    private File file;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Optional<List<ProgramSource>> sources;
        try {
            sources = ProgramSource.resolve(program, file);
        } catch (IOException e) {
            err.println("Cannot read " + file + ": " + ProgramSource.describe(e));
            err.flush();
            return 1;
        }
        if (sources.isEmpty()) {
            err.println("Unknown program: " + program);
            spec.commandLine().usage(err);
            return 1;
        }

        Config config = parent.getConfig();
        VmLimits limits = parent.getLimits();
        boolean trace = debug || (config.hasPath("stackvm.vm.trace") && config.getBoolean("stackvm.vm.trace"));
        printMachineSummary(out, limits, trace);

        ProgramRunner runner = new ProgramRunner(limits, trace, out, err, new ScannerInputSource(System.in));
        boolean allAssembled = true;
        for (ProgramSource source : sources.get()) {
            allAssembled &= runner.run(source.title(), source.source());
        }
        if (sources.get().size() > 1) {
            out.println();
            out.println("=== All programs completed ===");
        }
        out.flush();
        return allAssembled ? 0 : 1;
    }

    private static void printMachineSummary(PrintWriter out, VmLimits limits, boolean trace) {
        out.println("Bytecode Virtual Machine Interpreter");
        out.println("====================================");
        out.println("Stack size: " + limits.stackCapacity() + " entries");
        out.println("Call stack: " + limits.callStackCapacity() + " frames");
        out.println("Locals per frame: " + limits.localsPerFrame());
        out.println("Global variables: " + limits.globals());
        out.println("Code buffer: " + limits.codeCapacity() + " bytes");
        out.println("Total opcodes: " + Opcode.count());
        out.println("Debug mode: " + (trace ? "ON" : "OFF"));
    }
}
