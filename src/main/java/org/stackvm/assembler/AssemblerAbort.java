package org.stackvm.assembler;

/**
 * Internal exception used by the passes to stop at the first error.
 * It never leaves the {@link Assembler}.
 */
class AssemblerAbort extends RuntimeException {

    private final AssemblyError error;

    AssemblerAbort(AssemblyError error) {
        super(error.message(), null, false, false);
        this.error = error;
    }

    AssemblyError error() {
        return error;
    }
}
