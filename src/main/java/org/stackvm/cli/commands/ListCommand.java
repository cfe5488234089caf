package org.stackvm.cli.commands;

import org.stackvm.cli.SampleProgram;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "list", description = "Lists the bundled sample programs.")
public class ListCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Programs:");
        for (SampleProgram program : SampleProgram.values()) {
            out.printf("  %-11s - %s%n", program.id(), program.description());
        }
        out.printf("  %-11s - %s%n", ProgramSource.ALL, "Run all demo programs");
        out.flush();
        return 0;
    }
}
