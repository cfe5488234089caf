package org.stackvm.cli.commands;

import org.stackvm.cli.SampleProgram;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A titled assembly source selected on the command line.
 */
record ProgramSource(String title, String source) {

    /** The program name that selects every bundled program. */
    static final String ALL = "all";

    /**
     * Resolves the sources named on the command line. A file takes precedence over a name.
     *
     * @param name The bundled program name or {@value #ALL}.
     * @param file The assembly file, or null.
     * @return The sources in run order, or empty if the name is unknown.
     * @throws IOException if the file cannot be read.
     */
    static Optional<List<ProgramSource>> resolve(String name, File file) throws IOException {
        List<ProgramSource> sources = new ArrayList<>();
        if (file != null) {
            sources.add(new ProgramSource(file.getName(), Files.readString(file.toPath(), StandardCharsets.UTF_8)));
        } else if (ALL.equalsIgnoreCase(name)) {
            for (SampleProgram program : SampleProgram.demoOrder()) {
                sources.add(new ProgramSource(program.title(), program.source()));
            }
        } else {
            Optional<SampleProgram> program = SampleProgram.byId(name);
            if (program.isEmpty()) {
                return Optional.empty();
            }
            sources.add(new ProgramSource(program.get().title(), program.get().source()));
        }
        return Optional.of(sources);
    }

    /**
     * @param e The failure to read an assembly file.
     * @return A short reason for the console, without the path.
     */
    static String describe(IOException e) {
        if (e instanceof NoSuchFileException) {
            return "file not found";
        }
        if (e instanceof AccessDeniedException) {
            return "permission denied";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
