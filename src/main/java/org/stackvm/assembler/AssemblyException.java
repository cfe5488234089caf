package org.stackvm.assembler;

/**
 * Thrown when a program fails to assemble.
 * <p>
 * It is part of the public API and carries the {@link AssemblyError} describing the failure.
 */
public class AssemblyException extends Exception {

    private final AssemblyError error;

    /**
     * Constructs a new assembly exception.
     * @param error The error that stopped the assembly.
     */
    public AssemblyException(AssemblyError error) {
        super(error.toString());
        this.error = error;
    }

    public AssemblyError getError() {
        return error;
    }
}
