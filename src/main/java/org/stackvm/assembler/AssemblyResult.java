package org.stackvm.assembler;

import org.stackvm.runtime.model.BytecodeProgram;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The outcome of an assembly: either a program with its label table, or the error that
 * stopped the assembly.
 */
public final class AssemblyResult {

    private final BytecodeProgram program;
    private final Map<String, Integer> labels;
    private final AssemblyError error;

    private AssemblyResult(BytecodeProgram program, Map<String, Integer> labels, AssemblyError error) {
        this.program = program;
        this.labels = labels;
        this.error = error;
    }

    public static AssemblyResult success(BytecodeProgram program, Map<String, Integer> labels) {
        return new AssemblyResult(Objects.requireNonNull(program, "program"),
                Collections.unmodifiableMap(new LinkedHashMap<>(labels)), null);
    }

    public static AssemblyResult failure(AssemblyError error) {
        return new AssemblyResult(null, Map.of(), Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return The assembled program.
     * @throws IllegalStateException if the assembly failed.
     */
    public BytecodeProgram program() {
        if (program == null) {
            throw new IllegalStateException("Assembly failed: " + error);
        }
        return program;
    }

    /**
     * @return The address of every label in definition order; empty after a failure.
     */
    public Map<String, Integer> labels() {
        return labels;
    }

    /**
     * @return The error, or null after a success.
     */
    public AssemblyError error() {
        return error;
    }

    /**
     * @return The assembled program.
     * @throws AssemblyException if the assembly failed.
     */
    public BytecodeProgram orElseThrow() throws AssemblyException {
        if (error != null) {
            throw new AssemblyException(error);
        }
        return program;
    }

    @Override
    public String toString() {
        return isSuccess() ? "AssemblyResult[success, " + program.length() + " bytes]" : "AssemblyResult[" + error + "]";
    }
}
