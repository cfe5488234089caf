package org.stackvm.runtime.instructions;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.stackvm.runtime.isa.BytecodeWriter;
import org.stackvm.runtime.isa.Opcode;
import org.stackvm.runtime.testing.VmRunner;

import static org.assertj.core.api.Assertions.assertThat;

public class VMComparisonInstructionTest {

    @ParameterizedTest(name = "{1} {0} {2} = {3}")
    @Tag("unit")
    @CsvSource({
            "EQ, 3, 3, 1",
            "EQ, 3, 4, 0",
            "NE, 3, 4, 1",
            "NE, 3, 3, 0",
            "LT, 5, 10, 1",
            "LT, 10, 5, 0",
            "LT, -1, 0, 1",
            "LE, 5, 5, 1",
            "LE, 6, 5, 0",
            "GT, 5, 10, 0",
            "GT, 0, -1, 1",
            "GE, 5, 5, 1",
            "GE, 4, 5, 0"
    })
    void comparisonPushesOneOrZero(Opcode op, int a, int b, int expected) {
        int[] stack = VmRunner.run(new BytecodeWriter()
                .emit(Opcode.PUSH, a)
                .emit(Opcode.PUSH, b)
                .emit(op)
                .emit(Opcode.HALT)).vm.getState().getStack().toArray();

        assertThat(stack).containsExactly(expected);
    }
}
