package org.stackvm.assembler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stackvm.runtime.VmLimits;
import org.stackvm.runtime.model.BytecodeProgram;

import java.util.List;
import java.util.Objects;

/**
 * Translates assembly source into bytecode.
 * <p>
 * Assembly runs in two passes over the source (see {@link PassManager}) and stops at the
 * first error. Errors are returned as an {@link AssemblyResult} failure, never thrown.
 * An assembler holds no state between calls and can be reused.
 */
public class Assembler {

    private static final Logger LOG = LoggerFactory.getLogger(Assembler.class);

    private final VmLimits limits;

    /**
     * Creates an assembler with the default code capacity and label limit.
     */
    public Assembler() {
        this(VmLimits.DEFAULTS);
    }

    /**
     * @param limits The code capacity and label limit to enforce.
     */
    public Assembler(VmLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    /**
     * Assembles source text.
     * @param source      The assembly source.
     * @param programName The name reported in errors.
     * @return The program with its label table, or the first error.
     */
    public AssemblyResult assemble(String source, String programName) {
        Objects.requireNonNull(source, "source");
        return assemble(LineParser.split(source), programName);
    }

    /**
     * Assembles pre-split source lines.
     * @param lines       The source lines.
     * @param programName The name reported in errors.
     * @return The program with its label table, or the first error.
     */
    public AssemblyResult assemble(List<SourceLine> lines, String programName) {
        AssemblerContext context = new AssemblerContext(programName, limits);
        try {
            BytecodeProgram program = new PassManager(context).runPasses(lines);
            LOG.debug("Assembly successful: {} bytes ({} labels) for '{}'",
                    program.length(), context.labelCount(), programName);
            return AssemblyResult.success(program, context.getLabels());
        } catch (AssemblerAbort e) {
            LOG.debug("Assembly of '{}' failed: {}", programName, e.error());
            return AssemblyResult.failure(e.error());
        }
    }
}
