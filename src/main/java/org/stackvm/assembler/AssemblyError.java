package org.stackvm.assembler;

/**
 * Describes the error that stopped an assembly.
 *
 * @param code        the error category
 * @param message     the human-readable message
 * @param programName the name of the program being assembled
 * @param lineNumber  the 1-based source line, or -1 if the error is not tied to a line
 * @param lineContent the offending source line, empty if unknown
 */
public record AssemblyError(
        AssemblyErrorCode code,
        String message,
        String programName,
        int lineNumber,
        String lineContent
) {

    @Override
    public String toString() {
        if (lineNumber < 0) {
            return String.format("[%s] Error: %s", programName, message);
        }
        return String.format("[%s] Error line %d: %s", programName, lineNumber, message);
    }
}
