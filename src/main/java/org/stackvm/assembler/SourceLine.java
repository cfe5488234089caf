package org.stackvm.assembler;

/**
 * A single line of assembly source together with its 1-based line number.
 * This object is passed through both assembler passes.
 */
public record SourceLine(
        int lineNumber,
        String content
) {}
