package org.stackvm.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stackvm.runtime.VmLimits;
import org.stackvm.runtime.spi.InputSource;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ProgramRunnerTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private ProgramRunner runner(InputSource input) {
        return new ProgramRunner(VmLimits.DEFAULTS, false, new PrintWriter(out), new PrintWriter(err), input);
    }

    @Test
    void reportsListingOutputAndStatistics() {
        boolean assembled = runner(InputSource.EMPTY).run("Sum", "PUSH 2\nPUSH 3\nADD\nPRINT\nHALT");

        assertThat(assembled).isTrue();
        assertThat(out.toString())
                .contains("Running: Sum")
                .contains("Assembly successful: 13 bytes")
                .contains("=== Disassembly ===")
                .contains("=== Execution ===\n5\n")
                .contains("Instructions executed: 5")
                .contains("Final stack pointer: 0");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void runtimeFaultIsReportedButCountsAsRun() {
        boolean assembled = runner(InputSource.EMPTY).run("Divide", "PUSH 1\nPUSH 0\nDIV\nHALT");

        assertThat(assembled).isTrue();
        assertThat(err.toString()).startsWith("VM Error at PC=").contains("Division by zero");
        assertThat(out.toString()).contains("Instructions executed: 3");
    }

    @Test
    void assemblyErrorIsReportedWithTheOffendingLine() {
        boolean assembled = runner(InputSource.EMPTY).run("Broken", "NOP\n   PUSH   \n");

        assertThat(assembled).isFalse();
        assertThat(err.toString())
                .contains("[Broken] Error line 2: PUSH requires an operand")
                .contains("    > PUSH")
                .contains("Assembly failed!");
        assertThat(out.toString()).doesNotContain("=== Execution ===");
    }

    @Test
    void readsInputFromTheGivenSource() {
        runner(() -> OptionalInt.of(21)).run("Double", "READ\nPUSH 2\nMUL\nPRINT\nHALT");

        assertThat(out.toString()).contains("42\n");
    }
}
