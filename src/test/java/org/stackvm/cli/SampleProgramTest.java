package org.stackvm.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.stackvm.assembler.Assembler;
import org.stackvm.assembler.AssemblyException;
import org.stackvm.runtime.VirtualMachine;
import org.stackvm.runtime.VmLimits;
import org.stackvm.runtime.model.VmStatus;
import org.stackvm.runtime.spi.InputSource;
import org.stackvm.runtime.testing.RecordingOutputSink;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Assembles and runs every bundled program end to end.
 */
@Tag("integration")
class SampleProgramTest {

    private final RecordingOutputSink output = new RecordingOutputSink();
    private VirtualMachine vm;

    private String run(SampleProgram sample) throws AssemblyException {
        vm = new VirtualMachine(new Assembler().assemble(sample.source(), sample.id()).orElseThrow(),
                VmLimits.DEFAULTS, output, InputSource.EMPTY, new RecordingOutputSink(), false);
        assertThat(vm.run()).isEqualTo(VmStatus.HALTED);
        return output.text();
    }

    @ParameterizedTest
    @EnumSource(SampleProgram.class)
    void everySampleHaltsWithCleanStacks(SampleProgram sample) throws AssemblyException {
        run(sample);

        assertThat(vm.getState().getFault()).isNull();
        assertThat(vm.getState().getStackPointer()).isZero();
        assertThat(vm.getState().getCallDepth()).isZero();
    }

    @Test
    void factorial() throws AssemblyException {
        assertThat(run(SampleProgram.FACTORIAL))
                .isEqualTo("Calculating 10! (factorial)...\n3628800\nDone!\n");
    }

    @Test
    void fibonacci() throws AssemblyException {
        StringBuilder expected = new StringBuilder("Fibonacci sequence:\n");
        for (int n : new int[] {0, 1, 1, 2, 3, 5, 8, 13, 21, 34, 55, 89, 144, 233, 377}) {
            expected.append(n).append('\n');
        }
        expected.append("Done!\n");

        assertThat(run(SampleProgram.FIBONACCI)).isEqualTo(expected.toString());
    }

    @Test
    void nestedCalls() throws AssemblyException {
        assertThat(run(SampleProgram.NESTED)).isEqualTo("""
                Testing nested calls...
                outer called with: 5
                  inner called with: 5
                  inner returning: 10
                Final result: 15
                """);
    }

    @Test
    void arithmetic() throws AssemblyException {
        assertThat(run(SampleProgram.ARITHMETIC)).isEqualTo("""
                === Arithmetic Demo ===
                10 + 25 = 35
                100 - 37 = 63
                7 * 8 = 56
                99 / 9 = 11
                17 % 5 = 2
                5 < 10 = 1
                5 > 10 = 0
                === Done ===
                """);
    }

    @Test
    void lookupById() {
        assertThat(SampleProgram.byId("fibonacci")).contains(SampleProgram.FIBONACCI);
        assertThat(SampleProgram.byId("FACTORIAL")).contains(SampleProgram.FACTORIAL);
        assertThat(SampleProgram.byId("missing")).isEmpty();
    }

    @Test
    void demoOrderStartsWithArithmetic() {
        assertThat(SampleProgram.demoOrder()).containsExactly(
                SampleProgram.ARITHMETIC, SampleProgram.FACTORIAL, SampleProgram.FIBONACCI, SampleProgram.NESTED);
        assertThat(SampleProgram.ARITHMETIC.title()).isEqualTo("Arithmetic Demo");
    }
}
