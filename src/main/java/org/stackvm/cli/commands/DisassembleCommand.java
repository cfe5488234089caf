package org.stackvm.cli.commands;

import org.stackvm.assembler.Assembler;
import org.stackvm.assembler.AssemblyResult;
import org.stackvm.cli.CommandLineInterface;
import org.stackvm.runtime.services.Disassembler;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "disasm", description = "Assembles a program and prints its disassembly without running it.")
public class DisassembleCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", defaultValue = ProgramSource.ALL,
            description = "Program to list: factorial, fibonacci, nested, arithmetic or all (default: all).")
    private String program;

    @Option(names = {"-f", "--file"}, description = "List the given assembly file instead of a bundled program.")
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

        Assembler assembler = new Assembler(parent.getLimits());
        Disassembler disassembler = new Disassembler();
        int exitCode = 0;
        for (ProgramSource source : sources.get()) {
            out.println("; " + source.title());
            AssemblyResult result = assembler.assemble(source.source(), source.title());
            if (!result.isSuccess()) {
                err.println(result.error());
                exitCode = 1;
                continue;
            }
            out.print(disassembler.render(result.program()));
            if (!result.labels().isEmpty()) {
                out.println("Labels:");
                result.labels().entrySet().stream()
                        .sorted(Map.Entry.comparingByValue())
                        .forEach(e -> out.printf("  %04d  %s%n", e.getValue(), e.getKey()));
            }
            out.println();
        }
        out.flush();
        err.flush();
        return exitCode;
    }
}
