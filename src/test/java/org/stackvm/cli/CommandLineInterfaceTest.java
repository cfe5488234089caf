package org.stackvm.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stackvm.cli.config.LoggingConfigurator;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
class CommandLineInterfaceTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine cmd;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        cmd = new CommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
    }

    @Test
    void commandName() {
        assertThat(cmd.getCommandName()).isEqualTo("stackvm");
        assertThat(cmd.getSubcommands()).containsKeys("run", "disasm", "list", "help");
    }

    @Test
    void runsBundledProgram() {
        int exitCode = cmd.execute("run", "factorial");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("Bytecode Virtual Machine Interpreter")
                .contains("Debug mode: OFF")
                .contains("Assembly successful")
                .contains("=== Execution ===")
                .contains("3628800")
                .doesNotContain("=== All programs completed ===");
    }

    @Test
    void runsAllPrograms() {
        int exitCode = cmd.execute("run");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("3628800")
                .contains("Final result: 15")
                .contains("17 % 5 = 2")
                .contains("=== All programs completed ===");
        String report = out.toString();
        assertThat(report.indexOf("Running: Arithmetic Demo"))
                .isNotNegative()
                .isLessThan(report.indexOf("Running: Recursive Factorial"));
        assertThat(report.indexOf("Running: Recursive Factorial"))
                .isLessThan(report.indexOf("Running: Fibonacci Sequence"));
        assertThat(report.indexOf("Running: Fibonacci Sequence"))
                .isLessThan(report.indexOf("Running: Nested Function Calls"));
    }

    @Test
    void debugFlagTracesExecution() {
        int exitCode = cmd.execute("run", "-d", "arithmetic");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Debug mode: ON").contains("[0000] PRINT_STR");
    }

    @Test
    void unknownProgramFails() {
        int exitCode = cmd.execute("run", "quicksort");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown program: quicksort");
    }

    @Test
    void runsAssemblyFile(@TempDir Path dir) throws IOException {
        Path source = Files.writeString(dir.resolve("sum.asm"), "PUSH 2\nPUSH 3\nADD\nPRINT\nHALT\n");

        int exitCode = cmd.execute("run", "-f", source.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("sum.asm").contains("5\n");
    }

    @Test
    void assemblyErrorGivesExitCodeOne(@TempDir Path dir) throws IOException {
        Path source = Files.writeString(dir.resolve("broken.asm"), "PUSH 1\nJUMP nowhere\n");

        int exitCode = cmd.execute("run", "-f", source.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString())
                .contains("Error line 2: Unknown instruction 'JUMP'")
                .contains("Assembly failed!");
    }

    @Test
    void disassemblesProgram() {
        int exitCode = cmd.execute("disasm", "factorial");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("; Recursive Factorial")
                .contains("=== Disassembly ===")
                .contains("PRINT_STR")
                .contains("Labels:")
                .contains("factorial");
    }

    @Test
    void listsPrograms() {
        int exitCode = cmd.execute("list");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .startsWith("Programs:")
                .contains("factorial   - Recursive factorial (10!)")
                .contains("all         - Run all demo programs");
    }

    @Test
    void missingConfigFileIsAUsageError(@TempDir Path dir) {
        int exitCode = cmd.execute("--config", dir.resolve("absent.conf").toString(), "disasm", "factorial");

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("was not found");
    }

    @Test
    void configFileOverridesLimits(@TempDir Path dir) throws IOException {
        Path conf = Files.writeString(dir.resolve("small.conf"), "stackvm.vm.stack-capacity = 32\n");

        int exitCode = cmd.execute("--config", conf.toString(), "run", "nested");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Stack size: 32 entries");
    }

    @Test
    void nonPositiveCapacityIsAUsageError(@TempDir Path dir) throws IOException {
        Path conf = Files.writeString(dir.resolve("zero.conf"), "stackvm.vm.stack-capacity = 0\n");

        int exitCode = cmd.execute("--config", conf.toString(), "run", "factorial");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString())
                .contains("Invalid configuration: stack-capacity must be positive, got 0")
                .doesNotContain("IllegalArgumentException");
        assertThat(out.toString()).doesNotContain("3628800");
    }

    @Test
    void mistypedCapacityIsAUsageError(@TempDir Path dir) throws IOException {
        Path conf = Files.writeString(dir.resolve("typo.conf"), "stackvm.vm.stack-capacity = abc\n");

        int exitCode = cmd.execute("--config", conf.toString(), "disasm", "factorial");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString())
                .contains("Invalid configuration:")
                .contains("stack-capacity")
                .doesNotContain("ConfigException");
    }

    @Test
    void missingAssemblyFileIsReportedOnOneLine(@TempDir Path dir) {
        Path missing = dir.resolve("nope.asm");

        int exitCode = cmd.execute("run", "-f", missing.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString())
                .isEqualTo("Cannot read " + missing + ": file not found" + System.lineSeparator());
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void disasmReportsMissingAssemblyFile(@TempDir Path dir) {
        Path missing = dir.resolve("gone.asm");

        int exitCode = cmd.execute("disasm", "-f", missing.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Cannot read " + missing + ": file not found");
    }
}
